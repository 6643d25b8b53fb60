package me.golemcore.pilot.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pilot.domain.model.AbortSignal;
import me.golemcore.pilot.domain.model.ExecutionStep;
import me.golemcore.pilot.domain.model.OutcomeStatus;
import me.golemcore.pilot.domain.model.StateSnapshot;
import me.golemcore.pilot.domain.model.StructuredRequest;
import me.golemcore.pilot.domain.model.SummaryReport;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.testsupport.ScriptedLlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummarizerServiceTest {

    private static final StateSnapshot EXAMPLE = new StateSnapshot("https://example.com", "Example Domain", "");

    private PilotProperties properties;
    private ScriptedLlmPort llm;
    private SummarizerService summarizer;

    @BeforeEach
    void setUp() {
        properties = new PilotProperties();
        llm = new ScriptedLlmPort();
        summarizer = new SummarizerService(llm, new ObjectMapper(), properties);
    }

    private static ExecutionStep step(int index, String action, boolean success) {
        return new ExecutionStep(index, action, "https://example.com", success, Instant.EPOCH);
    }

    // ==================== classification ====================

    @Test
    void shouldClassifySuccessWhenFinalStateAndNoFailures() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "getPageContext", true)), EXAMPLE, null);

        assertEquals(OutcomeStatus.SUCCESS, report.getStatus());
        assertTrue(report.isTaskCompleted());
        assertEquals("https://example.com", report.getFinalUrl());
    }

    @Test
    void shouldClassifyFailedWhenNothingSucceeded() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "navigate", false)), null, null);

        assertEquals(OutcomeStatus.FAILED, report.getStatus());
        assertFalse(report.isTaskCompleted());
        assertNull(report.getFinalUrl());
    }

    @Test
    void shouldClassifyPartialWhenFinalStateDespiteFailures() {
        SummaryReport report = summarizer.summarize(
                List.of(step(1, "getPageContext", true), step(2, "click", false)), EXAMPLE, null);

        assertEquals(OutcomeStatus.PARTIAL, report.getStatus());
        assertFalse(report.isTaskCompleted());
        assertEquals(2, report.getTotalSteps());
        assertEquals(1, report.getSuccessCount());
        assertEquals(1, report.getFailureCount());
    }

    @Test
    void shouldClassifyPartialWhenNavigationSucceededWithoutFinalState() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "navigate", true)), null, null);

        assertEquals(OutcomeStatus.PARTIAL, report.getStatus());
    }

    @Test
    void shouldNotCountNonNavigationSuccessAsPartial() {
        SummaryReport report = summarizer.summarize(
                List.of(step(1, "click", true), step(2, "type", false)), null, null);

        assertEquals(OutcomeStatus.FAILED, report.getStatus());
    }

    @Test
    void shouldTreatBlankFinalUrlAsMissing() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "click", true)),
                new StateSnapshot(" ", null, null), null);

        assertEquals(OutcomeStatus.FAILED, report.getStatus());
    }

    @Test
    void shouldClassifyEmptyTrajectoryWithFinalStateAsSuccess() {
        SummaryReport report = summarizer.summarize(null, EXAMPLE, null);

        assertEquals(OutcomeStatus.SUCCESS, report.getStatus());
        assertEquals(0, report.getTotalSteps());
    }

    @Test
    void shouldCapAbortedRunAtPartial() {
        SummaryReport report = summarizer.summarize(
                List.of(step(1, "getPageContext", true), step(2, "navigate", true), step(3, "getPageContext", true)),
                EXAMPLE, null, Duration.ofMillis(300), true);

        assertEquals(OutcomeStatus.PARTIAL, report.getStatus());
        assertFalse(report.isTaskCompleted());
        assertTrue(report.getSummary().contains("⚠️ Status: Partial"));
        assertTrue(report.getSummary().contains("Execution was aborted before the objective could be confirmed."));
        assertTrue(report.getSummary().endsWith("TASK_COMPLETED: NO"));
    }

    @Test
    void shouldKeepFailedStatusForAbortedRunWithoutProgress() {
        SummaryReport report = summarizer.summarize(List.of(), null, null, null, true);

        assertEquals(OutcomeStatus.FAILED, report.getStatus());
        assertFalse(report.isTaskCompleted());
    }

    // ==================== report layout ====================

    @Test
    void shouldRenderFixedShapeReport() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "navigate", true), step(2, "getPageContext", true)),
                EXAMPLE, "Opened the page and read it.", Duration.ofMillis(1250), false);

        String[] lines = report.getSummary().split("\n");
        assertEquals("---", lines[0]);
        assertEquals("## Summary & Next Steps", lines[1]);
        assertEquals("✅ Status: Success", lines[3]);
        assertEquals("Steps: 2 total — 2 success, 0 failed", lines[4]);
        assertEquals("Final URL: https://example.com", lines[5]);
        assertEquals("Duration: 1250ms", lines[6]);
        assertEquals("Opened the page and read it.", lines[8]);
        assertEquals("Next Steps:", lines[10]);
        assertEquals("TASK_COMPLETED: YES", lines[lines.length - 1]);
    }

    @Test
    void shouldUseTemplatedToplineWithoutNarrative() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "navigate", false)), null, "  ");

        assertTrue(report.getSummary().contains("❌ Status: Failed"));
        assertTrue(report.getSummary().contains("Final URL: N/A"));
        assertTrue(report.getSummary().contains("Duration: N/A"));
        assertTrue(report.getSummary().contains("Execution did not complete as requested."));
        assertTrue(report.getSummary().contains("- Verify target URL and connectivity."));
        assertTrue(report.getSummary().endsWith("TASK_COMPLETED: NO"));
    }

    @Test
    void shouldRenderPartialRecommendations() {
        SummaryReport report = summarizer.summarize(List.of(step(1, "navigate", true)), null, null);

        assertTrue(report.getSummary().contains("⚠️ Status: Partial"));
        assertTrue(report.getSummary().contains("- Confirm the page context is gathered after navigation."));
    }

    @Test
    void shouldHonorConfiguredNavigationTools() {
        properties.getToolLoop().setNavigationTools(List.of("goto"));

        SummaryReport report = summarizer.summarize(List.of(step(1, "goto", true)), null, null);

        assertEquals(OutcomeStatus.PARTIAL, report.getStatus());
    }

    // ==================== narrative ====================

    @Test
    void shouldSkipNarrativeWhenDisabled() {
        Optional<String> narrative = summarizer.generateNarrative("objective", List.of(), "done", AbortSignal.create());

        assertTrue(narrative.isEmpty());
        assertTrue(llm.structuredRequests().isEmpty());
    }

    @Test
    void shouldGenerateNarrativeWhenEnabled() {
        properties.getSummarizer().setLlmNarrativeEnabled(true);
        llm.onStructured("RunNarrative", request -> "{\"summary\": \"Visited example.com.\"}");

        Optional<String> narrative = summarizer.generateNarrative("go to example.com",
                List.of(step(1, "navigate", true)), "All done", AbortSignal.create());

        assertEquals(Optional.of("Visited example.com."), narrative);
        StructuredRequest request = llm.structuredRequests().get(0);
        assertTrue(request.getPrompt().contains("Objective: go to example.com"));
        assertTrue(request.getPrompt().contains("- 1. navigate https://example.com (ok)"));
        assertTrue(request.getPrompt().contains("All done"));
    }

    @Test
    void shouldReturnEmptyNarrativeOnFailure() {
        properties.getSummarizer().setLlmNarrativeEnabled(true);

        Optional<String> narrative = summarizer.generateNarrative("objective", List.of(), null, AbortSignal.create());

        assertTrue(narrative.isEmpty());
    }

    @Test
    void shouldReturnEmptyNarrativeWhenModelUnavailable() {
        properties.getSummarizer().setLlmNarrativeEnabled(true);
        llm.available(false);

        assertTrue(summarizer.generateNarrative("objective", List.of(), null, AbortSignal.create()).isEmpty());
        assertTrue(llm.structuredRequests().isEmpty());
    }

    @Test
    void shouldSkipNarrativeWhenAborted() {
        properties.getSummarizer().setLlmNarrativeEnabled(true);
        llm.onStructured("RunNarrative", request -> "{\"summary\": \"Visited example.com.\"}");
        AbortSignal signal = AbortSignal.create();
        signal.abort("user cancelled");

        assertTrue(summarizer.generateNarrative("objective", List.of(), null, signal).isEmpty());
        assertTrue(llm.structuredRequests().isEmpty());
    }
}
