package org.javai.sqlassist.validate;

import java.util.List;

/**
 * One independent heuristic comparing a question with the SQL generated for it.
 *
 * <p>Rules are pure: no state, no side effects, no exceptions. Most report at most one
 * violation; a rule may report several when it checks several schema objects.</p>
 */
public interface ValidationRule {

	/**
	 * @return violations found, empty when the rule does not apply or is satisfied
	 */
	List<RuleViolation> evaluate(ValidationInput input);

	default String name() {
		return getClass().getSimpleName();
	}
}
