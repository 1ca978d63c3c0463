package net.quay.core.model;

public record TaskError(Kind kind, String message) {
    public enum Kind {
        UNKNOWN_TASK("UnknownTask"),
        TRANSIENT("TransientError"),
        PERMANENT("PermanentError"),
        TIMEOUT("TimeoutError");

        private final String code;

        Kind(String code) { this.code = code; }

        public String code() { return code; }

        public static Kind from(String code) {
            for (Kind k : values()) {
                if (k.code.equals(code)) return k;
            }
            return PERMANENT;
        }
    }

    @Override
    public String toString() {
        return kind.code() + ": " + message;
    }
}
