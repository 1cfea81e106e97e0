package pl.marcinmilkowski.string_analyzer.query;

import com.alibaba.fastjson2.JSONObject;

/**
 * A natural-language query together with the filters it was translated into.
 */
public record InterpretedQuery(String original, FilterSet parsedFilters) {

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("original", original);
        obj.put("parsed_filters", parsedFilters.toJson());
        return obj;
    }
}
