package io.mydata.core.error;

/** Thrown when a resource cannot be rendered as a markup document. */
public final class MarkupRenderException extends ResourceException {

    private static final long serialVersionUID = 1L;

    public MarkupRenderException(String message, Throwable cause, String kind) {
        super(message, cause, kind, Phase.RENDERING);
    }
}
