package pl.marcinmilkowski.string_analyzer.query;

import com.alibaba.fastjson2.JSONObject;

/**
 * Structured list filters. Every field is optional; {@code null} means "not constrained".
 * Built from query parameters or by {@link NaturalLanguageTranslator}.
 */
public record FilterSet(
    Boolean isPalindrome,
    Integer minLength,
    Integer maxLength,
    Integer wordCount,
    String containsCharacter
) {
    private static final FilterSet EMPTY = new FilterSet(null, null, null, null, null);

    public static FilterSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return isPalindrome == null && minLength == null && maxLength == null
            && wordCount == null && containsCharacter == null;
    }

    /**
     * Only the present fields, in a fixed order.
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        if (isPalindrome != null) obj.put("is_palindrome", isPalindrome);
        if (minLength != null) obj.put("min_length", minLength);
        if (maxLength != null) obj.put("max_length", maxLength);
        if (wordCount != null) obj.put("word_count", wordCount);
        if (containsCharacter != null) obj.put("contains_character", containsCharacter);
        return obj;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable builder. The translator reads fields back while it accumulates bounds.
     */
    public static class Builder {
        private Boolean isPalindrome;
        private Integer minLength;
        private Integer maxLength;
        private Integer wordCount;
        private String containsCharacter;

        public Builder isPalindrome(Boolean isPalindrome) {
            this.isPalindrome = isPalindrome;
            return this;
        }

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder wordCount(Integer wordCount) {
            this.wordCount = wordCount;
            return this;
        }

        public Builder containsCharacter(String containsCharacter) {
            this.containsCharacter = containsCharacter;
            return this;
        }

        /**
         * Raise the lower bound; a looser bound than the current one is ignored.
         */
        public Builder tightenMinLength(int candidate) {
            this.minLength = minLength == null ? candidate : Math.max(minLength, candidate);
            return this;
        }

        /**
         * Lower the upper bound; a looser bound than the current one is ignored.
         */
        public Builder tightenMaxLength(int candidate) {
            this.maxLength = maxLength == null ? candidate : Math.min(maxLength, candidate);
            return this;
        }

        public String containsCharacter() {
            return containsCharacter;
        }

        public boolean isEmpty() {
            return build().isEmpty();
        }

        public FilterSet build() {
            return new FilterSet(isPalindrome, minLength, maxLength, wordCount, containsCharacter);
        }
    }
}
