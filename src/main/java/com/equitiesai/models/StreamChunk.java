package com.equitiesai.models;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One incremental delta of a streamed completion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamChunk {
    private final String content;
    private final String finishReason;

    public StreamChunk(String content, String finishReason) {
        this.content = content != null ? content : "";
        this.finishReason = finishReason;
    }

    public static StreamChunk empty() {
        return new StreamChunk("", null);
    }

    public String getContent() {
        return content;
    }

    public String getFinishReason() {
        return finishReason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamChunk)) return false;
        StreamChunk that = (StreamChunk) o;
        return content.equals(that.content) && Objects.equals(finishReason, that.finishReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, finishReason);
    }

    @Override
    public String toString() {
        return "StreamChunk{content='" + content + "', finishReason=" + finishReason + "}";
    }
}
