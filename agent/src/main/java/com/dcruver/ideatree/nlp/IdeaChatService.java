package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.classify.LanguageRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Free-form chat with the Ollama model, used for group summaries.
 */
@Service
@Slf4j
public class IdeaChatService {

    private final ChatModel chatModel;
    private final LanguageRules rules;

    public IdeaChatService(ChatModel chatModel, LanguageRules rules) {
        this.chatModel = chatModel;
        this.rules = rules;
        log.info("IdeaChatService initialized with ChatModel: {}", chatModel.getClass().getSimpleName());
    }

    /**
     * Generate a response with system and user messages
     */
    public String chat(String systemMessage, String userMessage) {
        List<Message> messages = new ArrayList<>();

        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(new SystemMessage(systemMessage));
        }

        messages.add(new UserMessage(userMessage));

        try {
            ChatResponse response = chatModel.call(new Prompt(messages));
            if (response.getResults().isEmpty()) {
                log.warn("No response generated");
                return "";
            }
            return response.getResult().getOutput().getText();
        } catch (Exception e) {
            log.error("Failed to generate chat response", e);
            return "";
        }
    }

    /**
     * Short prose summary of the ideas filed under a group, or under one of its subgroups.
     */
    public String summarize(String group, String subgroup, List<String> ideas) {
        boolean english = rules.getLocale().getLanguage().equals(Locale.ENGLISH.getLanguage());
        String scope = subgroup == null ? group : group + " / " + subgroup;

        String systemMessage = english
            ? "You summarise a list of ideas in 2-4 plain sentences. Do not invent ideas that are not listed."
            : "Resumes una lista de ideas en 2-4 frases sencillas. No inventes ideas que no estén en la lista.";

        StringBuilder userMessage = new StringBuilder();
        userMessage.append(english ? "Group: " : "Grupo: ").append(scope).append("\n");
        userMessage.append(english ? "Ideas:\n" : "Ideas:\n");
        for (String idea : ideas) {
            userMessage.append("- ").append(idea).append('\n');
        }
        userMessage.append(english ? "\nSummary:" : "\nResumen:");

        return chat(systemMessage, userMessage.toString());
    }
}
