package com.nevis.ingest.graph;

import java.util.List;
import java.util.Map;

public record GraphLiteral(
    Kind kind,
    Map<String, Object> namedArguments,
    List<Object> positionalArguments,
    int start,
    int end
) {

    public enum Kind {
        NODE("Node"),
        RELATIONSHIP("Relationship");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        static Kind fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return kind;
                }
            }
            return null;
        }
    }

    /**
     * Looks up an argument by any of its accepted names, falling back to its position.
     */
    public Object argument(int position, String... names) {
        for (String name : names) {
            if (namedArguments.containsKey(name)) {
                return namedArguments.get(name);
            }
        }
        return position < positionalArguments.size() ? positionalArguments.get(position) : null;
    }
}
