package org.javai.sqlassist.config;

import org.javai.sqlassist.schema.TableInfo;

/**
 * @param sampleRows number of sample rows fetched per table, between 0 and {@link TableInfo#MAX_SAMPLE_ROWS}
 */
public record IntrospectionSettings(int sampleRows) {

	public IntrospectionSettings {
		if (sampleRows < 0 || sampleRows > TableInfo.MAX_SAMPLE_ROWS) {
			throw new IllegalArgumentException("sampleRows must be between 0 and " + TableInfo.MAX_SAMPLE_ROWS);
		}
	}

	public static IntrospectionSettings defaults() {
		return new IntrospectionSettings(TableInfo.MAX_SAMPLE_ROWS);
	}
}
