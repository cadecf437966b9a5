package com.papertrail.core.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.papertrail.core.model.NodeLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * FalkorDB implementation using the JFalkorDB client.
 *
 * <p>Parameters are inlined into the query as Cypher literals. Strings,
 * numbers, booleans, lists and maps are supported; dates and enums are written
 * as strings.</p>
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("graph.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("graph.execute query={}", processedQuery);
        graph.query(processedQuery);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processedQuery = processParams(query, params);
        log.debug("graph.query query={}", processedQuery);

        ResultSet resultSet = graph.query(processedQuery);
        List<Map<String, Object>> results = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("graph.connection_check_failed graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        for (NodeLabel label : NodeLabel.values()) {
            safeExecute("CREATE INDEX FOR (n:" + label.getLabel() + ") ON (n.id)");
            safeExecute("CREATE INDEX FOR (n:" + label.getLabel() + ") ON (n.run_id)");
        }
        safeExecute("CREATE INDEX FOR (f:" + GraphStoreWriter.RED_FLAG_LABEL + ") ON (f.run_id)");
        safeExecute("CREATE INDEX FOR (r:" + GraphStoreWriter.RUN_LABEL + ") ON (r.id)");
        log.info("graph.indexes_created graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index already exists
            log.debug("graph.index_skipped query={} reason={}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $param} placeholders, longest name first so that
     * {@code $run} never eats the prefix of {@code $runId}.
     */
    static String processParams(String query, Map<String, Object> params) {
        List<Map.Entry<String, Object>> entries = new ArrayList<>(params.entrySet());
        entries.sort(Comparator.comparingInt((Map.Entry<String, Object> e) -> e.getKey().length()).reversed());
        String result = query;
        for (Map.Entry<String, Object> entry : entries) {
            result = result.replace("$" + entry.getKey(), formatValue(entry.getValue()));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Iterable<?> items) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            Iterator<?> it = items.iterator();
            while (it.hasNext()) {
                joiner.add(formatValue(it.next()));
            }
            return joiner.toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                InputSanitizer.validateIdentifier(key);
                joiner.add(key + ": " + formatValue(entry.getValue()));
            }
            return joiner.toString();
        }
        if (value instanceof Enum<?> e) {
            return quote(e.name());
        }
        if (value instanceof TemporalAccessor) {
            return quote(value.toString());
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        InputSanitizer.sanitizeForCypher(s);
        return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("graph.close_failed graph={}", graphName, e);
        }
        log.info("graph.closed graph={}", graphName);
    }
}
