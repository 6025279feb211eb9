package dev.aparikh.msgexplorer.filter;

/**
 * How a text-search token is compared with a lowercased dimension value.
 */
public enum TextMatch {
    PREFIX {
        @Override
        public boolean matches(String value, String token) {
            return value.startsWith(token);
        }
    },
    SUBSTRING {
        @Override
        public boolean matches(String value, String token) {
            return value.contains(token);
        }
    };

    public abstract boolean matches(String value, String token);
}
