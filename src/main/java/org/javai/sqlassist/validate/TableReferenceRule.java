package org.javai.sqlassist.validate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * When the question names a table (in singular form) the query should use that table.
 *
 * <p>The singular form is the lower-cased table name with one trailing "s" removed. A table
 * counts as used when its name appears in the SQL or a table referenced by the SQL starts with
 * the singular form. Each table the question names but the SQL ignores costs 15 points.</p>
 */
public final class TableReferenceRule implements ValidationRule {

	private static final Logger logger = LoggerFactory.getLogger(TableReferenceRule.class);

	static final int DEDUCTION = 15;

	private static final Pattern FROM_OR_JOIN = Pattern.compile(
			"\\b(?:FROM|JOIN)\\s+([`\"\\[]?[\\w.]+[`\"\\]]?)", Pattern.CASE_INSENSITIVE);

	@Override
	public List<RuleViolation> evaluate(ValidationInput input) {
		List<String> tableNames = input.schema().tableNames();
		if (tableNames.isEmpty()) {
			return List.of();
		}
		String sqlLower = input.sqlLower();
		Set<String> referenced = null;
		List<RuleViolation> violations = new ArrayList<>();
		for (String tableName : tableNames) {
			String tableLower = tableName.toLowerCase(Locale.ROOT);
			String singular = singular(tableLower);
			if (singular.isEmpty() || !input.questionLower().contains(singular)) {
				continue;
			}
			if (sqlLower.contains(tableLower)) {
				continue;
			}
			if (referenced == null) {
				referenced = referencedTables(input.sql());
			}
			if (referenced.stream().anyMatch(name -> name.startsWith(singular))) {
				continue;
			}
			violations.add(new RuleViolation(DEDUCTION,
					"Question mentions '%s' but query does not use the %s table".formatted(singular, tableName),
					"Consider querying the \"%s\" table".formatted(tableName)));
		}
		return violations;
	}

	static String singular(String tableLower) {
		return tableLower.endsWith("s") ? tableLower.substring(0, tableLower.length() - 1) : tableLower;
	}

	/**
	 * Lower-cased, unquoted, unqualified names of the tables the SQL reads from.
	 */
	static Set<String> referencedTables(String sql) {
		Set<String> names = new LinkedHashSet<>();
		if (sql == null || sql.isBlank()) {
			return names;
		}
		try {
			Statement statement = CCJSqlParserUtil.parse(sql);
			for (String table : new TablesNamesFinder().getTables(statement)) {
				names.add(normalise(table));
			}
			return names;
		}
		catch (JSQLParserException | RuntimeException e) {
			logger.debug("Could not parse SQL, scanning FROM/JOIN clauses instead: {}", e.getMessage());
		}
		Matcher matcher = FROM_OR_JOIN.matcher(sql);
		while (matcher.find()) {
			names.add(normalise(matcher.group(1)));
		}
		return names;
	}

	private static String normalise(String tableReference) {
		String unqualified = tableReference.trim();
		int dot = unqualified.lastIndexOf('.');
		if (dot >= 0) {
			unqualified = unqualified.substring(dot + 1);
		}
		return unqualified.replaceAll("[`\"\\[\\]]", "").toLowerCase(Locale.ROOT);
	}
}
