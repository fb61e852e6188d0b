package org.javai.sqlassist.config;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Builds the chat client used for remote generation.
 *
 * <p>Remote generation is optional: without an API key the assistant runs on the pattern
 * generator alone.</p>
 */
public final class ChatClientFactory {

	public static final String API_KEY_VARIABLE = "OPENAI_API_KEY";

	private static final Logger logger = LoggerFactory.getLogger(ChatClientFactory.class);

	private ChatClientFactory() {
	}

	/**
	 * Looks up {@value #API_KEY_VARIABLE} as a system property, then as an environment variable.
	 */
	public static Optional<ChatClient> fromEnvironment(GenerationSettings settings) {
		String apiKey = System.getProperty(API_KEY_VARIABLE);
		if (apiKey == null || apiKey.isBlank()) {
			apiKey = System.getenv(API_KEY_VARIABLE);
		}
		return forApiKey(apiKey, settings);
	}

	public static Optional<ChatClient> forApiKey(String apiKey, GenerationSettings settings) {
		if (apiKey == null || apiKey.isBlank()) {
			logger.info("{} not set; remote query generation disabled", API_KEY_VARIABLE);
			return Optional.empty();
		}
		GenerationSettings effective = settings != null ? settings : GenerationSettings.defaults();
		OpenAiApi openAiApi = OpenAiApi.builder().apiKey(apiKey).build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(effective.model())
				.temperature(effective.temperature())
				.maxTokens(effective.maxTokens())
				.build();
		return Optional.of(ChatClient.builder(chatModel)
				.defaultOptions(options)
				.build());
	}
}
