package com.sysmon.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestResponse(String status, String reason) {

    public static IngestResponse accepted() {
        return new IngestResponse("accepted", null);
    }

    public static IngestResponse rejected(String reason) {
        return new IngestResponse("rejected", reason);
    }

    public static IngestResponse error(String reason) {
        return new IngestResponse("error", reason);
    }
}
