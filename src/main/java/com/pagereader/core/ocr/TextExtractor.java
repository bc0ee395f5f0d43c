package com.pagereader.core.ocr;

import com.pagereader.core.image.ImageVariant;

/**
 * Внешний OCR. Для декодируемого растра не бросает исключений: пустая строка вместо ошибки.
 */
@FunctionalInterface
public interface TextExtractor {
    /**
     * @param languageHint языки движка, напр. "rus+eng"
     * @return распознанный текст, возможно пустой
     */
    String extract(ImageVariant variant, String languageHint);
}
