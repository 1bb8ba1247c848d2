package com.dcruver.ideatree.nlp;

import com.dcruver.ideatree.classify.LanguageRules;
import com.dcruver.ideatree.config.IdeaTreeProperties;
import com.dcruver.ideatree.domain.IdeaTree;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asks the Ollama chat model to classify a note, either as free JSON text or
 * through a {@code classify_note} tool call.
 */
@Service
@Slf4j
public class OllamaClassificationOracle implements ClassificationOracle {

    private final ChatModel chatModel;
    private final ClassificationPrompts prompts;
    private final LanguageRules rules;
    private final IdeaTreeProperties.Oracle settings;
    private final AtomicInteger threadCount = new AtomicInteger();
    // a call that times out is interrupted and never holds a thread needed by the next call
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "classification-oracle-" + threadCount.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public OllamaClassificationOracle(ChatModel chatModel, ClassificationPrompts prompts,
                                      LanguageRules rules, IdeaTreeProperties properties) {
        this.chatModel = chatModel;
        this.prompts = prompts;
        this.rules = rules;
        this.settings = properties.getOracle();
        log.info("Classification oracle in {} mode, timeout {} ms", settings.getMode(), settings.getTimeoutMs());
    }

    @Override
    public RawProposal classify(String note, IdeaTree tree, Locale locale) {
        Prompt prompt = buildPrompt(note, tree, rulesFor(locale));
        Future<ChatResponse> call = executor.submit(() -> chatModel.call(prompt));
        ChatResponse response;
        try {
            response = call.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Model did not answer within {} ms", settings.getTimeoutMs());
            throw new OracleUnavailableException("Model timed out after " + settings.getTimeoutMs() + " ms", e);
        } catch (ExecutionException e) {
            log.error("Model call failed", e.getCause());
            throw new OracleUnavailableException("Model call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while waiting for the model", e);
        }

        if (response == null || response.getResult() == null) {
            log.warn("Model returned no generations");
            return RawProposal.text("");
        }

        AssistantMessage output = response.getResult().getOutput();
        if (settings.getMode() == IdeaTreeProperties.OracleMode.TOOL && output.hasToolCalls()) {
            List<String> arguments = output.getToolCalls().stream()
                .map(AssistantMessage.ToolCall::arguments)
                .toList();
            log.debug("Model answered with {} tool call(s)", arguments.size());
            return RawProposal.toolCalls(arguments);
        }
        log.debug("Model answered: {}", output.getText());
        return RawProposal.text(output.getText());
    }

    private LanguageRules rulesFor(Locale locale) {
        if (locale == null || locale.getLanguage().equals(rules.getLocale().getLanguage())) {
            return rules;
        }
        return LanguageRules.forLanguage(locale.getLanguage());
    }

    private Prompt buildPrompt(String note, IdeaTree tree, LanguageRules language) {
        List<Message> messages = List.of(
            new SystemMessage(prompts.system(language)),
            new UserMessage(prompts.user(note, tree, language)));

        OllamaOptions.Builder options = OllamaOptions.builder()
            .temperature(settings.getTemperature());
        if (settings.getMode() == IdeaTreeProperties.OracleMode.TOOL) {
            options.toolCallbacks(List.of(new ClassifyNoteTool(prompts.toolDescription(language))))
                .internalToolExecutionEnabled(false);
        }
        return new Prompt(messages, options.build());
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Tool declaration only. Calls are returned to the caller instead of executed.
     */
    static class ClassifyNoteTool implements ToolCallback {

        private final ToolDefinition definition;

        ClassifyNoteTool(String description) {
            this.definition = DefaultToolDefinition.builder()
                .name(ClassificationPrompts.TOOL_NAME)
                .description(description)
                .inputSchema(ClassificationPrompts.TOOL_SCHEMA)
                .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            return toolInput;
        }
    }
}
