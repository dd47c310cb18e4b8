package com.example.pipeline.config;

import com.example.pipeline.event.StatusChangePublisher;
import com.example.pipeline.model.CandidateStatus;
import com.example.pipeline.model.CandidateTimeAnalytics;
import com.example.pipeline.service.SystemAnalyticsAggregator;
import com.example.pipeline.service.TimeAnalyticsService;
import com.example.pipeline.service.TimeInStageCalculator;
import com.example.pipeline.service.TransitionCoordinator;
import com.example.pipeline.service.TransitionResult;
import com.example.pipeline.store.InMemoryCandidateStore;
import com.example.pipeline.store.SampleCandidates;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.example.pipeline.CandidateFixtures.CLOCK;
import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineMcpConfiguration tools")
class PipelineMcpConfigurationTest {

    @Mock
    private McpTransportContext ctx;

    private InMemoryCandidateStore store;
    private List<McpStatelessServerFeatures.SyncToolSpecification> tools;
    private List<McpStatelessServerFeatures.SyncPromptSpecification> prompts;

    @BeforeEach
    void setUp() {
        store = new InMemoryCandidateStore();
        SampleCandidates.seed(store, CLOCK);
        TransitionCoordinator coordinator = new TransitionCoordinator(store,
                new StatusChangePublisher(Runnable::run, List.of()), CLOCK);
        TimeInStageCalculator calculator = new TimeInStageCalculator(CLOCK);
        TimeAnalyticsService analytics = new TimeAnalyticsService(store, calculator,
                new SystemAnalyticsAggregator(calculator), PipelineProperties.defaults());

        PipelineMcpConfiguration configuration = new PipelineMcpConfiguration();
        tools = configuration.pipelineTools(coordinator, analytics, store);
        prompts = configuration.pipelinePrompts(analytics);
    }

    private McpSchema.CallToolResult call(String name, Map<String, Object> args) {
        McpStatelessServerFeatures.SyncToolSpecification spec = tools.stream()
                .filter(t -> t.tool().name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No tool " + name));
        return spec.callHandler().apply(ctx, new McpSchema.CallToolRequest(name, args));
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    private static Map<String, Object> transitionArgs(String id, String expected, String target) {
        Map<String, Object> args = new HashMap<>();
        args.put("candidateId", id);
        args.put("expectedStatus", expected);
        args.put("newStatus", target);
        args.put("changedBy", "recruiter-9");
        args.put("reason", "Offer approved");
        return args;
    }

    @Test
    @DisplayName("Should register every pipeline tool with a read-only or write annotation")
    void shouldRegisterTools() {
        assertThat(tools).extracting(t -> t.tool().name()).containsExactlyInAnyOrder(
                "transitionCandidateStatus", "getCandidateStatusHistory", "getCandidateTimeAnalytics",
                "getSystemTimeAnalytics", "getCandidatesStuckInStage", "getAverageTimeBetweenStatuses",
                "getPipelineStatuses");
        assertThat(tools).allSatisfy(t -> assertThat(t.tool().annotations()).isNotNull());
        assertThat(prompts).extracting(p -> p.prompt().name()).containsExactly("stuck-candidates-report");
    }

    @Test
    @DisplayName("Should commit a transition requested by display label")
    void shouldCommitTransition() {
        // When
        McpSchema.CallToolResult result = call("transitionCandidateStatus",
                transitionArgs("C002", "Reference Check", "Offer"));

        // Then
        assertThat(result.isError()).isFalse();
        assertThat(result.structuredContent()).isInstanceOf(TransitionResult.class);
        assertThat(text(result)).contains("COMMITTED").contains("Offer approved");
        assertThat(store.findById("C002").orElseThrow().currentStatus()).isEqualTo(CandidateStatus.OFFER);
    }

    @Test
    @DisplayName("Should report a conflict naming the actual status")
    void shouldReportConflict() {
        McpSchema.CallToolResult result = call("transitionCandidateStatus",
                transitionArgs("C002", "Applied", "Offer"));

        assertThat(result.isError()).isTrue();
        assertThat(text(result)).contains("Concurrency conflict").contains("Reference Check");
        assertThat(store.findById("C002").orElseThrow().currentStatus()).isEqualTo(CandidateStatus.REFERENCE_CHECK);
    }

    @Test
    @DisplayName("Should turn invalid arguments into error results")
    void shouldRejectInvalidArguments() {
        Map<String, Object> unknownStatus = transitionArgs("C002", "Reference Check", "Interviewing");
        Map<String, Object> noActor = transitionArgs("C002", "Reference Check", "Offer");
        noActor.remove("changedBy");

        assertThat(text(call("transitionCandidateStatus", unknownStatus))).contains("Unknown status 'Interviewing'");
        assertThat(call("transitionCandidateStatus", noActor).isError()).isTrue();
        assertThat(call("getCandidateTimeAnalytics", Map.of("candidateId", "C001", "thresholdDays", 0)).isError())
                .isTrue();
        assertThat(text(call("getCandidateStatusHistory", Map.of("candidateId", "nobody"))))
                .isEqualTo("Candidate not found: nobody");
    }

    @Test
    @DisplayName("Should answer analytics queries over the seeded population")
    void shouldAnswerAnalyticsQueries() {
        McpSchema.CallToolResult candidate = call("getCandidateTimeAnalytics", Map.of("candidateId", "C001"));
        McpSchema.CallToolResult system = call("getSystemTimeAnalytics", Map.of());
        McpSchema.CallToolResult stuck = call("getCandidatesStuckInStage", Map.of("status", "Reference Check"));
        McpSchema.CallToolResult between = call("getAverageTimeBetweenStatuses",
                Map.of("fromStatus", "Applied", "toStatus", "Reference Check"));

        assertThat(candidate.isError()).isFalse();
        assertThat(candidate.structuredContent()).isInstanceOfSatisfying(CandidateTimeAnalytics.class,
                a -> assertThat(a.isStuck()).isTrue());
        assertThat(system.isError()).isFalse();
        assertThat(text(system)).contains("conversionFunnel").contains("averageTimeToHire");
        assertThat(text(stuck)).contains("C001");
        assertThat(between.isError()).isFalse();
        assertThat(text(between)).contains("averageDays");
    }

    @Test
    @DisplayName("Should key per-stage averages and medians by status label")
    void shouldKeyStageMapsByLabel() {
        String json = text(call("getSystemTimeAnalytics", Map.of()));

        assertThat(json).contains("\"Reference Check\" :");
        assertThat(json).doesNotContain("REFERENCE_CHECK");
    }

    @Test
    @DisplayName("Should answer invalid prompt arguments with an explanatory prompt result")
    void shouldRejectInvalidPromptArguments() {
        McpStatelessServerFeatures.SyncPromptSpecification report = prompts.get(0);

        McpSchema.GetPromptResult notNumber = report.promptHandler()
                .apply(ctx, new McpSchema.GetPromptRequest("stuck-candidates-report", Map.of("thresholdDays", "soon")));
        McpSchema.GetPromptResult notPositive = report.promptHandler()
                .apply(ctx, new McpSchema.GetPromptRequest("stuck-candidates-report", Map.of("thresholdDays", 0)));

        assertThat(notNumber.description()).isEqualTo(PipelineMcpConfiguration.INVALID_PROMPT_ARGUMENTS);
        assertThat(((McpSchema.TextContent) notNumber.messages().get(0).content()).text())
                .contains("thresholdDays must be a whole number");
        assertThat(notPositive.description()).isEqualTo(PipelineMcpConfiguration.INVALID_PROMPT_ARGUMENTS);
        assertThat(((McpSchema.TextContent) notPositive.messages().get(0).content()).text())
                .contains("thresholdDays must be positive");
    }

    @Test
    @DisplayName("Should render the stuck candidates prompt")
    void shouldRenderPrompt() {
        McpSchema.GetPromptResult result = prompts.get(0).promptHandler()
                .apply(ctx, new McpSchema.GetPromptRequest("stuck-candidates-report", Map.of("thresholdDays", "14")));

        String body = ((McpSchema.TextContent) result.messages().get(0).content()).text();
        assertThat(body).contains("in stage > 14 days").contains("C001");
    }
}
