package com.document.verification.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Detects which shape the OCR output arrived in and wraps it as an {@link OcrDocument}.
 * A mapping containing a {@code fields} key is treated as nested; anything else as flat.
 */
public class OcrDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(OcrDocumentParser.class);

    /**
     * Parses the raw OCR mapping. Never throws; malformed input yields {@link OcrDocument.Empty}.
     */
    public OcrDocument parse(Map<String, ?> ocrData) {
        if (ocrData == null || ocrData.isEmpty()) {
            return new OcrDocument.Empty();
        }

        if (!ocrData.containsKey(MetadataKeys.FIELDS)) {
            return new OcrDocument.Flat(OcrDocument.copyOf(ocrData));
        }

        Object fields = ocrData.get(MetadataKeys.FIELDS);
        if (!(fields instanceof Map<?, ?> fieldMap)) {
            log.debug("ocr.malformed reason=fields-not-a-mapping type={}",
                    fields == null ? "null" : fields.getClass().getSimpleName());
            return new OcrDocument.Empty();
        }

        Object meta = ocrData.get(MetadataKeys.FIELDS_META);
        Map<String, Object> metaMap;
        if (meta instanceof Map<?, ?> rawMeta) {
            metaMap = OcrDocument.copyOf(rawMeta);
        } else {
            if (meta != null) {
                log.debug("ocr.malformed reason=fields_meta-not-a-mapping type={}", meta.getClass().getSimpleName());
            }
            metaMap = Map.of();
        }

        return new OcrDocument.Nested(OcrDocument.copyOf(fieldMap), metaMap, OcrDocument.copyOf(ocrData));
    }
}
