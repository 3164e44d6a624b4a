package com.document.verification.reconcile;

import com.document.verification.core.InvalidInputException;
import com.document.verification.core.model.ReconciledField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Aligns the OCR output and the user's edits into one list of comparable fields.
 *
 * <p>The field set is the union of the user keys and the OCR value keys, minus
 * {@link MetadataKeys#EXCLUDED} and any {@code *_confidence} key. Fields are returned in
 * ascending lexicographic order of their keys.</p>
 */
public class FieldReconciler {
    private static final Logger log = LoggerFactory.getLogger(FieldReconciler.class);

    private final OcrDocumentParser parser;

    public FieldReconciler() {
        this(new OcrDocumentParser());
    }

    public FieldReconciler(OcrDocumentParser parser) {
        this.parser = parser;
    }

    /**
     * Reconciles both sources.
     *
     * @param ocrData  OCR output in flat or nested shape; may be null
     * @param userData user-edited values; may be null
     * @return reconciled fields in key order
     * @throws InvalidInputException if both inputs are null or empty
     */
    public List<ReconciledField> reconcile(Map<String, ?> ocrData, Map<String, ?> userData) {
        if (isAbsent(ocrData) && isAbsent(userData)) {
            throw new InvalidInputException("Both ocrData and userData are missing");
        }

        OcrDocument ocr = parser.parse(ocrData);
        Map<String, Object> user = OcrDocument.copyOf(userData);

        SortedSet<String> keys = new TreeSet<>();
        for (String key : ocr.candidateKeys()) {
            if (!MetadataKeys.isExcluded(key)) {
                keys.add(key);
            }
        }
        for (String key : user.keySet()) {
            if (!MetadataKeys.isExcluded(key)) {
                keys.add(key);
            }
        }

        List<ReconciledField> fields = new ArrayList<>(keys.size());
        for (String key : keys) {
            fields.add(new ReconciledField(
                    key,
                    ValueCoercion.asText(ocr.rawValue(key)),
                    ValueCoercion.asConfidence(ocr.rawConfidence(key)),
                    ValueCoercion.asText(user.get(key))));
        }

        log.debug("fields.reconciled shape={} ocrKeys={} userKeys={} fieldCount={}",
                ocr.getClass().getSimpleName(), ocr.candidateKeys().size(), user.size(), fields.size());
        return fields;
    }

    private static boolean isAbsent(Map<String, ?> data) {
        return data == null || data.isEmpty();
    }
}
