package com.eyelevel.documentanalysis.model;

/**
 * The engine that produced a run's extracted text.
 */
public enum ExtractionMethod {
    /**
     * Fast path: synchronous Amazon Textract text detection.
     */
    TEXTRACT,
    /**
     * Fallback path: a vision-capable Bedrock model reading the original document.
     */
    BEDROCK_VISION
}
