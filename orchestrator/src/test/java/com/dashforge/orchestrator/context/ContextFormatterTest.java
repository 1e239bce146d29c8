package com.dashforge.orchestrator.context;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextFormatterTest {

    ContextFormatter formatter = new ContextFormatter();

    @Test
    void format_emptyContext_rendersPlaceholder() {
        assertThat(formatter.format(Map.of())).isEqualTo("No additional context available.");
        assertThat(formatter.format(null)).isEqualTo(ContextFormatter.EMPTY);
    }

    @Test
    void format_nestedSections_rendersHeadingsAndBullets() {
        Map<String, Object> mysql = new LinkedHashMap<>();
        mysql.put("query_rate", "SELECT COUNT(*) FROM queries");
        mysql.put("slow_queries", "SELECT * FROM slow_log");

        Map<String, Object> sql = new LinkedHashMap<>();
        sql.put("mysql", mysql);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("sql_examples", sql);
        context.put("note", "keep it simple");

        assertThat(formatter.format(context)).isEqualTo("""
                ## Sql Examples

                ### Mysql
                - Query Rate: SELECT COUNT(*) FROM queries
                - Slow Queries: SELECT * FROM slow_log

                ## Note
                keep it simple
                """);
    }

    @Test
    void format_listLeaf_isCommaJoined() {
        Map<String, Object> example = new LinkedHashMap<>();
        example.put("panels", List.of("CPU Usage", "Memory Usage"));

        assertThat(formatter.format(Map.of("system_dashboard_example", example)))
                .contains("## System Dashboard Example")
                .contains("- Panels: CPU Usage, Memory Usage");
    }

    @Test
    void titleCase_splitsOnUnderscores() {
        assertThat(ContextFormatter.titleCase("sql_examples")).isEqualTo("Sql Examples");
        assertThat(ContextFormatter.titleCase("CPU_usage")).isEqualTo("Cpu Usage");
    }
}
