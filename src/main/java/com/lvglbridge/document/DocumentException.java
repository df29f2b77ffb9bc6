// ============================================================================
// Checked failure of the structured-text document layer
// ============================================================================

package com.lvglbridge.document;

public class DocumentException extends Exception {
    public DocumentException(String message) {
        super(message);
    }

    public DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
