package work.lcod.html2wt.runtime;

/**
 * Fatal serialization failure. Aborts the whole walk; no partial output is valid afterwards.
 */
public final class SerializationException extends RuntimeException {
    public static final String MISSING_RECONSTRUCTION_DATA = "missing_reconstruction_data";
    public static final String INVALID_SOURCE_RANGE = "invalid_source_range";
    public static final String INVALID_PROVENANCE = "invalid_provenance";
    public static final String INTERNAL_ERROR = "internal_error";

    private final String code;
    private final Object data;

    public SerializationException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public SerializationException(String code, String message) {
        this(code, message, null);
    }

    public SerializationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = null;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
