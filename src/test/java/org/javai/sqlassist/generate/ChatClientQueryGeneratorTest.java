package org.javai.sqlassist.generate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.javai.sqlassist.config.GenerationSettings;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.InMemorySchemaCatalog;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientQueryGeneratorTest {

	private static final SchemaCatalog SCHEMA = new InMemorySchemaCatalog().addColumns("users", "id", "name");

	private static ChatClient clientReturning(String content) {
		ChatClient client = mock(ChatClient.class, RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenReturn(content);
		return client;
	}

	@Test
	void successfulResponseIsStrippedOfCodeFences() {
		ChatClientQueryGenerator generator = new ChatClientQueryGenerator(
				clientReturning("```sql\nSELECT COUNT(*) FROM users;\n```"));

		GenerationAttempt attempt = generator.attempt("How many users?", SCHEMA, Documentation.empty());

		assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.SUCCESS);
		assertThat(attempt.query()).contains("SELECT COUNT(*) FROM users;");
		assertThat(attempt.modelId()).isEqualTo(GenerationSettings.DEFAULT_MODEL);
		assertThat(attempt.errorDetails()).isNull();
	}

	@Test
	void promptCarriesSchemaContextAndQuestion() {
		ChatClient client = clientReturning("SELECT 1");
		new ChatClientQueryGenerator(client).attempt("How many users?", SCHEMA, Documentation.empty());

		ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
		verify(client.prompt()).user(prompt.capture());
		assertThat(prompt.getValue())
				.contains("TABLE: users")
				.contains("    - name: TEXT")
				.contains("QUESTION: How many users?");
	}

	@Test
	void emptyResponseIsReported() {
		GenerationAttempt attempt = new ChatClientQueryGenerator(clientReturning("```\n```"))
				.attempt("How many users?", SCHEMA, Documentation.empty());

		assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.EMPTY_RESPONSE);
		assertThat(attempt.isSuccess()).isFalse();
		assertThat(attempt.query()).isEmpty();
	}

	@Test
	void nullResponseIsReportedAsEmpty() {
		GenerationAttempt attempt = new ChatClientQueryGenerator(clientReturning(null))
				.attempt("How many users?", SCHEMA, Documentation.empty());

		assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.EMPTY_RESPONSE);
	}

	@Test
	void nonSelectResponseIsRefused() {
		GenerationAttempt attempt = new ChatClientQueryGenerator(clientReturning("DELETE FROM users"))
				.attempt("Remove everyone", SCHEMA, Documentation.empty());

		assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.NOT_A_SELECT);
		assertThat(attempt.errorDetails()).contains("DELETE FROM users");
	}

	@Test
	void clientExceptionBecomesRemoteError() {
		ChatClient client = mock(ChatClient.class, RETURNS_DEEP_STUBS);
		when(client.prompt().call().content()).thenThrow(new IllegalStateException("401 Unauthorized"));

		GenerationAttempt attempt = new ChatClientQueryGenerator(client)
				.attempt("How many users?", SCHEMA, Documentation.empty());

		assertThat(attempt.outcome()).isEqualTo(AttemptOutcome.REMOTE_ERROR);
		assertThat(attempt.errorDetails()).isEqualTo("IllegalStateException: 401 Unauthorized");
	}

	@Test
	void codeFenceMarkersAreRemovedAnywhere() {
		assertThat(ChatClientQueryGenerator.stripCodeFences("  ```SQL select 1 ```  ")).isEqualTo("select 1");
		assertThat(ChatClientQueryGenerator.stripCodeFences("SELECT 1")).isEqualTo("SELECT 1");
		assertThat(ChatClientQueryGenerator.stripCodeFences(null)).isEmpty();
	}

	@Test
	void clientIsRequired() {
		assertThatThrownBy(() -> new ChatClientQueryGenerator(null))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void configuredModelIsReportedOnAttempt() {
		ChatClient client = clientReturning("SELECT name FROM users");
		GenerationAttempt attempt = new ChatClientQueryGenerator(client,
				new GenerationSettings("gpt-4o-mini", 0.0, 200))
				.attempt("names", SCHEMA, Documentation.empty());

		verify(client.prompt()).user(anyString());
		assertThat(attempt.modelId()).isEqualTo("gpt-4o-mini");
		assertThat(attempt.query()).contains("SELECT name FROM users");
	}
}
