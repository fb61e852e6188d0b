package org.javai.sqlassist;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.javai.sqlassist.generate.GenerationMethod;
import org.javai.sqlassist.validate.ValidationResult;

/**
 * What a caller receives for a question: the candidate query, how it was produced and how well
 * it is believed to answer the question.
 */
@JsonPropertyOrder({ "query", "method", "validation" })
public record QueryAnswer(String query, GenerationMethod method, ValidationResult validation) {

	public QueryAnswer {
		if (query == null || method == null || validation == null) {
			throw new IllegalArgumentException("query, method and validation are required");
		}
	}
}
