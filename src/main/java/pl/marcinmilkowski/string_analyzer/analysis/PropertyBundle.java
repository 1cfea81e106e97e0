package pl.marcinmilkowski.string_analyzer.analysis;

import com.alibaba.fastjson2.JSONObject;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Properties derived from a string value, computed once when the record is created.
 *
 * <p>The frequency map is kept sorted by character so that its JSON form is
 * reproducible.</p>
 */
public record PropertyBundle(
    int length,
    boolean isPalindrome,
    int uniqueCharacters,
    int wordCount,
    String sha256Hash,
    Map<String, Integer> characterFrequency
) {
    public PropertyBundle {
        characterFrequency = Collections.unmodifiableMap(new TreeMap<>(characterFrequency));
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("length", length);
        obj.put("is_palindrome", isPalindrome);
        obj.put("unique_characters", uniqueCharacters);
        obj.put("word_count", wordCount);
        obj.put("sha256_hash", sha256Hash);
        obj.put("character_frequency_map", new JSONObject(characterFrequency));
        return obj;
    }

    /**
     * Rebuild a bundle from its {@link #toJson()} form.
     *
     * @throws IllegalArgumentException if a field is missing
     */
    public static PropertyBundle fromJson(JSONObject obj) {
        JSONObject freqObj = obj.getJSONObject("character_frequency_map");
        if (freqObj == null || obj.getString("sha256_hash") == null) {
            throw new IllegalArgumentException("Incomplete property bundle: " + obj);
        }
        Map<String, Integer> frequency = new TreeMap<>();
        for (String key : freqObj.keySet()) {
            frequency.put(key, freqObj.getIntValue(key));
        }
        return new PropertyBundle(
            obj.getIntValue("length"),
            obj.getBooleanValue("is_palindrome"),
            obj.getIntValue("unique_characters"),
            obj.getIntValue("word_count"),
            obj.getString("sha256_hash"),
            frequency
        );
    }
}
