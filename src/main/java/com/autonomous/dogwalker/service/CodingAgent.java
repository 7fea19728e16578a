package com.autonomous.dogwalker.service;

import com.autonomous.dogwalker.model.AgentRequest;
import com.autonomous.dogwalker.model.AgentResponse;

/**
 * The code-writing engine. Takes a prompt and a checkout, edits files in
 * place and answers with text.
 */
public interface CodingAgent {

    AgentResponse invoke(AgentRequest request);
}
