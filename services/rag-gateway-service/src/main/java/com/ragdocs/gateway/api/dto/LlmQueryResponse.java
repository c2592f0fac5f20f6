package com.ragdocs.gateway.api.dto;

public class LlmQueryResponse extends SearchResponse {
    private String answer;

    @Override
    public LlmQueryResponse copy() {
        LlmQueryResponse copy = new LlmQueryResponse();
        copyInto(copy);
        copy.answer = answer;
        return copy;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }
}
