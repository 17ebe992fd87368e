package org.contractquard.analyzer.engine.finding;

import org.contractquard.analyzer.ir.element.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestFindings {

    private static Finding finding(String id, String title, Severity severity, String detector) {
        return new Finding.Builder(id).setTitle(title).setSeverity(severity).setDetector(detector)
                .setLocation(SourceLocation.of("A.sol", 3)).build();
    }

    @Test
    @DisplayName("ordering: severity first, then title")
    public void test1() {
        Finding low = finding("1", "Alpha", Severity.LOW, "x");
        Finding critical = finding("2", "Zulu", Severity.CRITICAL, "x");
        Finding medium2 = finding("3", "Delta", Severity.MEDIUM, "x");
        Finding medium1 = finding("4", "Bravo", Severity.MEDIUM, "x");
        List<Finding> sorted = Findings.deduplicateAndSort(List.of(low, critical, medium2, medium1));
        assertEquals(List.of(critical, medium1, medium2, low), sorted);
    }

    @Test
    @DisplayName("deduplication keeps the more severe finding, the first one on a tie")
    public void test2() {
        Finding first = finding("dup", "Title", Severity.LOW, "first");
        Finding second = finding("dup", "Title", Severity.HIGH, "second");
        Finding third = finding("dup", "Title", Severity.HIGH, "third");
        List<Finding> result = Findings.deduplicateAndSort(List.of(first, second, third));
        assertEquals(1, result.size());
        assertEquals("second", result.get(0).detector());
    }

    @Test
    @DisplayName("stable for equal severity and title")
    public void test3() {
        Finding a = finding("a", "Same", Severity.INFO, "x");
        Finding b = finding("b", "Same", Severity.INFO, "x");
        assertEquals(List.of(b, a), Findings.deduplicateAndSort(List.of(b, a)));
        assertTrue(Findings.deduplicateAndSort(List.of()).isEmpty());
    }

    @Test
    @DisplayName("builder defaults and validation")
    public void test4() {
        Finding finding = new Finding.Builder("id").setTitle("T").addReference("SWC-100")
                .putMetadata("key", 3).putMetadata("ignored", null).build();
        assertEquals(Severity.INFO, finding.severity());
        assertEquals("unknown", finding.detector());
        assertEquals(1.0, finding.confidence());
        assertEquals("", finding.description());
        assertEquals(List.of("SWC-100"), finding.references());
        assertEquals(1, finding.metadata().size());

        assertThrows(IllegalArgumentException.class, () -> new Finding.Builder("id").setTitle("T")
                .setConfidence(1.5).build());
        assertThrows(NullPointerException.class, () -> new Finding.Builder("id").build());
    }

    @Test
    @DisplayName("severity ranks")
    public void test5() {
        assertTrue(Severity.CRITICAL.isMoreSevereThan(Severity.HIGH));
        assertFalse(Severity.INFO.isMoreSevereThan(Severity.LOW));
        assertFalse(Severity.MEDIUM.isMoreSevereThan(Severity.MEDIUM));
        assertEquals(0, Severity.CRITICAL.rank());
        assertEquals(4, Severity.INFO.rank());
    }
}
