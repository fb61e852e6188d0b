package org.javai.sqlassist.generate;

import java.util.Objects;
import java.util.regex.Pattern;
import org.javai.sqlassist.config.GenerationSettings;
import org.javai.sqlassist.exec.ReadOnlyQueryGuard;
import org.javai.sqlassist.prompt.SchemaContextRenderer;
import org.javai.sqlassist.prompt.SqlGenerationPrompt;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Generates SQL by asking a language model through Spring AI's {@link ChatClient}.
 *
 * <p>One call per question, no retry. The response is stripped of code fences and trimmed.
 * Any exception raised by the client is caught here and reported as
 * {@link AttemptOutcome#REMOTE_ERROR}.</p>
 */
public final class ChatClientQueryGenerator implements RemoteQueryGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientQueryGenerator.class);
	private static final Pattern CODE_FENCE = Pattern.compile("```(?:sql)?", Pattern.CASE_INSENSITIVE);

	private final ChatClient chatClient;
	private final GenerationSettings settings;

	public ChatClientQueryGenerator(ChatClient chatClient, GenerationSettings settings) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.settings = settings != null ? settings : GenerationSettings.defaults();
	}

	public ChatClientQueryGenerator(ChatClient chatClient) {
		this(chatClient, GenerationSettings.defaults());
	}

	@Override
	public GenerationAttempt attempt(String question, SchemaCatalog schema, Documentation documentation) {
		String prompt = new SqlGenerationPrompt(SchemaContextRenderer.render(schema, documentation), question)
				.render();
		long start = System.currentTimeMillis();
		String content;
		try {
			content = invokeModel(prompt);
		}
		catch (Exception e) {
			return GenerationAttempt.failure(AttemptOutcome.REMOTE_ERROR, settings.model(), elapsedSince(start),
					e.getClass().getSimpleName() + ": " + e.getMessage());
		}
		long duration = elapsedSince(start);

		String sql = stripCodeFences(content);
		if (sql.isEmpty()) {
			return GenerationAttempt.failure(AttemptOutcome.EMPTY_RESPONSE, settings.model(), duration,
					"model returned no SQL");
		}
		if (!ReadOnlyQueryGuard.isSelect(sql)) {
			return GenerationAttempt.failure(AttemptOutcome.NOT_A_SELECT, settings.model(), duration,
					"response does not start with SELECT: " + abbreviate(sql));
		}
		return GenerationAttempt.success(sql, settings.model(), duration);
	}

	private String invokeModel(String prompt) {
		logger.debug("Requesting SQL from {} ({} prompt chars)", settings.model(), prompt.length());
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		request.options(ChatOptions.builder()
				.model(settings.model())
				.temperature(settings.temperature())
				.maxTokens(settings.maxTokens())
				.build());
		request.user(prompt);
		String content = request.call().content();
		logger.info("LLM response:\n{}", content);
		return content;
	}

	/**
	 * Removes {@code ```sql} and {@code ```} markers anywhere in the response and trims the rest.
	 */
	static String stripCodeFences(String content) {
		if (content == null) {
			return "";
		}
		return CODE_FENCE.matcher(content).replaceAll("").trim();
	}

	private static long elapsedSince(long start) {
		return Math.max(0, System.currentTimeMillis() - start);
	}

	private static String abbreviate(String sql) {
		String oneLine = sql.replaceAll("\\s+", " ");
		return oneLine.length() > 80 ? oneLine.substring(0, 80) + "..." : oneLine;
	}
}
