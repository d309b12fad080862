package com.jay.cryptoagent.reasoning;

/**
 * External reasoning service. The agent always calls it statelessly: no conversation history
 * and no tools, so one prompt in gives one text out.
 */
public interface ReasoningClient {

    /**
     * @param model        model identifier
     * @param systemPrompt short system instruction
     * @param userPrompt   full context prompt
     * @param historyLimit prior turns to include; the agent always passes 0
     * @param toolsAllowed whether tool use is offered; the agent always passes false
     * @return the model's text reply
     * @throws ReasoningException on transport failure or an error reply
     */
    String generate(String model, String systemPrompt, String userPrompt, int historyLimit, boolean toolsAllowed);

    /** True when an API key is configured. */
    boolean isConfigured();
}
