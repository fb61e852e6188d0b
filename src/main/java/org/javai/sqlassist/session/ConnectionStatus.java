package org.javai.sqlassist.session;

/**
 * @param connected a data source is attached
 * @param hasSchema the schema has been introspected
 * @param hasDocumentation a non-empty documentation overlay is set
 */
public record ConnectionStatus(boolean connected, boolean hasSchema, boolean hasDocumentation) {

	static ConnectionStatus of(ConnectionSnapshot snapshot) {
		return new ConnectionStatus(snapshot.isConnected(), snapshot.hasSchema(),
				!snapshot.documentation().isEmpty());
	}
}
