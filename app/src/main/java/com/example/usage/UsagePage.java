package com.example.usage;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

public record UsagePage(List<JsonNode> records, String nextLink) {

    public boolean hasMore() {
        return nextLink != null && !nextLink.isBlank();
    }

    static UsagePage from(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw malformed("page is not a JSON object");
        }
        var value = body.get("value");
        if (value == null || !value.isArray()) {
            throw malformed("page has no 'value' array");
        }
        var next = body.get("nextLink");
        if (next != null && !next.isNull() && !next.isTextual()) {
            throw malformed("'nextLink' is not a string");
        }
        var records = new ArrayList<JsonNode>(value.size());
        value.forEach(records::add);
        return new UsagePage(List.copyOf(records), next == null || next.isNull() ? null : next.asText());
    }

    private static ApiCallException malformed(String message) {
        return new ApiCallException(ApiCallException.Outcome.MALFORMED, 200, message, null, null);
    }
}
