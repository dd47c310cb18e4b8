package com.example.pipeline.config;

import com.example.pipeline.model.Actor;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.StatusChangeSource;
import com.example.pipeline.model.StuckCandidate;
import com.example.pipeline.model.SystemWideTimeAnalytics;
import com.example.pipeline.service.InvalidPipelineRequestException;
import com.example.pipeline.service.TimeAnalyticsService;
import com.example.pipeline.service.TransitionCoordinator;
import com.example.pipeline.service.TransitionRequest;
import com.example.pipeline.service.TransitionResult;
import com.example.pipeline.store.CandidateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Hiring pipeline: MCP request surface.
 *
 * <p>Two groups of tools:
 * <ul>
 *   <li><b>Transitions</b>: compare-and-swap status changes and the per-candidate ledger.</li>
 *   <li><b>Time analytics</b>: time in stage per candidate, population-wide bottlenecks,
 *       stuck candidates, conversion funnel, time-to-hire and stage-to-stage timing.</li>
 * </ul>
 *
 * <p>Transport context headers consumed:
 * <ul>
 *   <li>{@code X-Team}           ops tooling: requesting team name</li>
 *   <li>{@code X-Candidate-ID}   candidate-facing agents: who the agent acts for</li>
 *   <li>{@code X-Correlation-ID} distributed trace propagation</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class PipelineMcpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineMcpConfiguration.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // =========================================================================
    // TOOL ANNOTATION PRESETS
    // =========================================================================

    private static final McpSchema.ToolAnnotations READ_ONLY =
            new McpSchema.ToolAnnotations(null, true, false, true, false, false);

    private static final McpSchema.ToolAnnotations WRITE =
            new McpSchema.ToolAnnotations(null, false, false, false, false, false);

    static final String INVALID_PROMPT_ARGUMENTS = "Invalid prompt arguments";

    private static final String[] STATUS_LABELS =
            Arrays.stream(CandidateStatus.values()).map(CandidateStatus::label).toArray(String[]::new);

    private static final String[] SOURCE_VALUES =
            Arrays.stream(StatusChangeSource.values()).map(StatusChangeSource::wireValue).toArray(String[]::new);

    // =========================================================================
    // TOOLS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncToolSpecification> pipelineTools(
            TransitionCoordinator coordinator,
            TimeAnalyticsService analytics,
            CandidateStore store) {
        return Stream.of(
                transitionTools(coordinator, store),
                timeAnalyticsTools(analytics),
                pipelineKnowledgeTools()
        ).flatMap(List::stream).toList();
    }

    // ------------------------------------------------------------------ transitions

    private List<McpStatelessServerFeatures.SyncToolSpecification> transitionTools(
            TransitionCoordinator coordinator, CandidateStore store) {
        return List.of(

            tool("transitionCandidateStatus",
                "Transition Candidate Status",
                "Move a candidate to a new pipeline status. The change only applies if the candidate is still " +
                "in expectedStatus (the status you last read). On a conflict nothing changes: re-read the " +
                "candidate and decide again. Every applied change is recorded in the status history.",
                WRITE,
                schema(props(
                    "candidateId",    prop("string", "Candidate ID, e.g. C001"),
                    "expectedStatus", propEnum("Status the caller last observed", STATUS_LABELS),
                    "newStatus",      propEnum("Status to move to", STATUS_LABELS),
                    "changedBy",      prop("string", "User ID or process name making the change"),
                    "changedByName",  prop("string", "Display name of the actor"),
                    "changedByEmail", prop("string", "Email of the actor"),
                    "reason",         prop("string", "Why the status changed"),
                    "notes",          prop("string", "Additional context"),
                    "source",         propEnum("Origin of the change, default manual", SOURCE_VALUES)),
                    List.of("candidateId", "expectedStatus", "newStatus", "changedBy")),
                (ctx, req) -> {
                    String id = str(req, "candidateId");
                    logCtx(ctx, "transitionCandidateStatus", id);
                    TransitionRequest request = new TransitionRequest(id,
                            status(req, "expectedStatus"),
                            status(req, "newStatus"),
                            new Actor(str(req, "changedBy"), str(req, "changedByName"), str(req, "changedByEmail")),
                            str(req, "reason"),
                            str(req, "notes"),
                            source(req, "source"));
                    TransitionResult result = coordinator.transition(request);
                    return switch (result.outcome()) {
                        case COMMITTED -> ok(toJson(result), result);
                        case CONCURRENCY_CONFLICT -> err("Concurrency conflict: candidate " + id + " is in status '"
                                + result.currentStatus().label() + "', not '" + request.expectedStatus().label()
                                + "'. Re-read the candidate and decide again.");
                        case NOT_FOUND -> err("Candidate not found: " + id);
                    };
                }),

            tool("getCandidateStatusHistory",
                "Get Candidate Status History",
                "Current status and the ordered status change history of a candidate (most recent 50 changes). " +
                "Use the returned currentStatus as expectedStatus when requesting a transition.",
                READ_ONLY,
                schema(props("candidateId", prop("string", "Candidate ID")), List.of("candidateId")),
                (ctx, req) -> {
                    String id = str(req, "candidateId");
                    logCtx(ctx, "getCandidateStatusHistory", id);
                    return store.findById(id).filter(c -> !c.deleted()).map(c -> {
                        Map<String, Object> view = new LinkedHashMap<>();
                        view.put("candidateId",   c.candidateId());
                        view.put("name",          c.name());
                        view.put("currentStatus", c.effectiveStatus());
                        view.put("dateCreated",   c.dateCreated());
                        view.put("statusHistory", c.statusHistory());
                        return ok(toJson(view), view);
                    }).orElse(err("Candidate not found: " + id));
                })
        );
    }

    // ------------------------------------------------------------------ time analytics

    private List<McpStatelessServerFeatures.SyncToolSpecification> timeAnalyticsTools(TimeAnalyticsService analytics) {
        return List.of(

            tool("getCandidateTimeAnalytics",
                "Get Candidate Time Analytics",
                "Time in the current stage, per-stage breakdown, total time in process and whether the candidate " +
                "is stuck. Use to answer 'how long has this candidate been waiting?'.",
                READ_ONLY,
                schema(props(
                    "candidateId",   prop("string", "Candidate ID"),
                    "thresholdDays", prop("integer", "Days in stage after which a candidate counts as stuck, default 14")),
                    List.of("candidateId")),
                (ctx, req) -> {
                    String id = str(req, "candidateId");
                    logCtx(ctx, "getCandidateTimeAnalytics", id);
                    return analytics.getCandidateTimeAnalytics(id, optInt(req, "thresholdDays"))
                            .map(a -> ok(toJson(a), a))
                            .orElse(err("Candidate not found: " + id));
                }),

            tool("getSystemTimeAnalytics",
                "Get System-Wide Time Analytics",
                "Average and median days per stage, bottleneck stages, stuck candidates, conversion funnel " +
                "(share of the current population per status), average time-to-hire and totals.",
                READ_ONLY,
                schema(props("thresholdDays", prop("integer", "Stuck threshold in days, default 14")), List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "getSystemTimeAnalytics", null);
                    return analytics.getSystemWideTimeAnalytics(optInt(req, "thresholdDays"))
                            .map(a -> ok(toJson(a), a))
                            .orElse(err("System-wide analytics timed out; try again later"));
                }),

            tool("getCandidatesStuckInStage",
                "Get Candidates Stuck in Stage",
                "Candidates currently in the given status for longer than the threshold, longest wait first.",
                READ_ONLY,
                schema(props(
                    "status",        propEnum("Pipeline status", STATUS_LABELS),
                    "thresholdDays", prop("integer", "Stuck threshold in days, default 14")),
                    List.of("status")),
                (ctx, req) -> {
                    CandidateStatus status = status(req, "status");
                    logCtx(ctx, "getCandidatesStuckInStage", status.label());
                    List<StuckCandidate> stuck = analytics.getCandidatesStuckInStage(status, optInt(req, "thresholdDays"));
                    if (stuck.isEmpty()) return ok("No candidates stuck in " + status.label());
                    return ok(toJson(stuck), Map.of("status", status, "stuckCandidates", stuck));
                }),

            tool("getAverageTimeBetweenStatuses",
                "Get Average Time Between Statuses",
                "Average days from entering fromStatus to the next entry into toStatus, across all candidates.",
                READ_ONLY,
                schema(props(
                    "fromStatus", propEnum("Starting status", STATUS_LABELS),
                    "toStatus",   propEnum("Target status", STATUS_LABELS)),
                    List.of("fromStatus", "toStatus")),
                (ctx, req) -> {
                    CandidateStatus from = status(req, "fromStatus");
                    CandidateStatus to   = status(req, "toStatus");
                    logCtx(ctx, "getAverageTimeBetweenStatuses", from.label() + "->" + to.label());
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("fromStatus",  from);
                    view.put("toStatus",    to);
                    view.put("averageDays", analytics.getAverageTimeBetweenStatuses(from, to));
                    return ok(toJson(view), view);
                })
        );
    }

    // ------------------------------------------------------------------ pipeline knowledge

    private List<McpStatelessServerFeatures.SyncToolSpecification> pipelineKnowledgeTools() {
        return List.of(

            tool("getPipelineStatuses",
                "Get Pipeline Statuses",
                "The pipeline status set in conventional funnel order, with terminal flags. Any status may " +
                "follow any other; no transition graph is enforced.",
                READ_ONLY,
                schema(Map.of(), List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "getPipelineStatuses", null);
                    List<Map<String, Object>> statuses = Arrays.stream(CandidateStatus.values())
                            .map(s -> Map.<String, Object>of(
                                    "status",     s.label(),
                                    "name",       s.name(),
                                    "isTerminal", s.isTerminal(),
                                    "isInitial",  s == CandidateStatus.INITIAL))
                            .toList();
                    Map<String, Object> view = Map.of(
                            "statuses", statuses,
                            "sources",  List.of(SOURCE_VALUES));
                    return ok(toJson(view), view);
                })
        );
    }

    // =========================================================================
    // PROMPTS
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncPromptSpecification> pipelinePrompts(TimeAnalyticsService analytics) {
        return List.of(

            prompt("stuck-candidates-report",
                "Operational report: candidates stuck in pipeline stages and the stages that slow the pipeline down.",
                List.of(arg("thresholdDays", "Minimum days in stage to flag as stuck, default 14", false)),
                (ctx, req) -> {
                    int days = intArg(req.arguments(), "thresholdDays", analytics.defaultThresholdDays());
                    List<StuckCandidate> stuck = analytics.getStuckCandidates(days);
                    List<SystemWideTimeAnalytics.BottleneckStage> bottlenecks = analytics.getSystemWideTimeAnalytics(days)
                            .map(SystemWideTimeAnalytics::bottleneckStages)
                            .orElse(List.of());
                    return promptResult("Stuck candidates operational report",
                        """
                        You are an HR operations analyst generating an actionable pipeline health report.

                        ## Stuck Candidates (in stage > %d days)
                        %s

                        ## Bottleneck Stages (average days in stage > %s)
                        %s

                        ## Report Requirements:
                        1. **Summary**: total stuck, breakdown by stage, most critical cases
                        2. **Stage Analysis**: which stages are the biggest bottlenecks right now
                        3. **Individual Actions**: for each stuck candidate: recommended next action, who should take it, urgency (HIGH/MEDIUM/LOW)
                        4. **Process Recommendations**: 2-3 systemic improvements to shorten time in stage
                        """.formatted(days, toJson(stuck), days / 2.0, toJson(bottlenecks)));
                })
        );
    }

    // =========================================================================
    // BUILDER HELPERS
    // =========================================================================

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(McpTransportContext ctx, McpSchema.CallToolRequest req);
    }

    private McpStatelessServerFeatures.SyncToolSpecification tool(
            String name, String title, String description,
            McpSchema.ToolAnnotations annotations, McpSchema.JsonSchema inputSchema,
            ToolHandler handler) {
        return McpStatelessServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name).title(title).description(description)
                        .inputSchema(inputSchema).annotations(annotations).build())
                .callHandler((ctx, req) -> {
                    try {
                        return handler.handle(ctx, req);
                    } catch (InvalidPipelineRequestException e) {
                        return err(e.getMessage());
                    }
                })
                .build();
    }

    private McpStatelessServerFeatures.SyncPromptSpecification prompt(
            String name, String description, List<McpSchema.PromptArgument> args,
            java.util.function.BiFunction<McpTransportContext, McpSchema.GetPromptRequest,
                    McpSchema.GetPromptResult> handler) {
        return new McpStatelessServerFeatures.SyncPromptSpecification(
                new McpSchema.Prompt(name, description, args),
                (ctx, req) -> {
                    try {
                        return handler.apply(ctx, req);
                    } catch (InvalidPipelineRequestException e) {
                        return promptResult(INVALID_PROMPT_ARGUMENTS, e.getMessage());
                    }
                });
    }

    private static McpSchema.PromptArgument arg(String name, String description, boolean required) {
        return new McpSchema.PromptArgument(name, description, required);
    }

    private static McpSchema.GetPromptResult promptResult(String description, String text) {
        return new McpSchema.GetPromptResult(description,
                List.of(new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent(text))));
    }

    // =========================================================================
    // CALL RESULT HELPERS
    // =========================================================================

    private McpSchema.CallToolResult ok(String text) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false);
    }

    private McpSchema.CallToolResult ok(String text, Object structured) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false, structured, null);
    }

    private static McpSchema.CallToolResult err(String message) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(message)), true);
    }

    // =========================================================================
    // SCHEMA HELPERS
    // =========================================================================

    private static McpSchema.JsonSchema schema(Map<String, Object> properties, List<String> required) {
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /** Insertion-ordered property map; {@code Map.of} caps out at ten entries. */
    private static Map<String, Object> props(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> propEnum(String description, String... values) {
        return Map.of("type", "string", "description", description, "enum", List.of(values));
    }

    // =========================================================================
    // ARGUMENT EXTRACTION HELPERS
    // =========================================================================

    private static String str(McpSchema.CallToolRequest req, String key) {
        Object v = req.arguments() == null ? null : req.arguments().get(key);
        return v instanceof String s ? s : null;
    }

    private static Integer optInt(McpSchema.CallToolRequest req, String key) {
        Object v = req.arguments() == null ? null : req.arguments().get(key);
        return v instanceof Number n ? Integer.valueOf(n.intValue()) : null;
    }

    private static int intArg(Map<String, Object> args, String key, int def) {
        Object v = args == null ? null : args.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new InvalidPipelineRequestException(key + " must be a whole number: " + s);
            }
        }
        return def;
    }

    private static CandidateStatus status(McpSchema.CallToolRequest req, String key) {
        String raw = str(req, key);
        if (raw == null) throw new InvalidPipelineRequestException(key + " is required");
        return CandidateStatus.parse(raw).orElseThrow(() -> new InvalidPipelineRequestException(
                "Unknown status '" + raw + "' for " + key + ". Valid: " + String.join(", ", STATUS_LABELS)));
    }

    private static StatusChangeSource source(McpSchema.CallToolRequest req, String key) {
        String raw = str(req, key);
        if (raw == null) return StatusChangeSource.MANUAL;
        return StatusChangeSource.parse(raw).orElseThrow(() -> new InvalidPipelineRequestException(
                "Unknown source '" + raw + "'. Valid: " + String.join(", ", SOURCE_VALUES)));
    }

    private void logCtx(McpTransportContext ctx, String tool, String subject) {
        String tenant  = ctx.get("X-Candidate-ID") instanceof String c ? "candidate=" + c
                       : ctx.get("X-Team")         instanceof String t ? "team=" + t : "env=unknown";
        String corr    = ctx.get("X-Correlation-ID") instanceof String c ? c : "-";
        log.info("[{}] [corr={}] tool={} subject={}", tenant, corr, tool, subject);
    }

    private String toJson(Object obj) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            return obj.toString();
        }
    }
}
