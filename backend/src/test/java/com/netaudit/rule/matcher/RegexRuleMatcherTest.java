package com.netaudit.rule.matcher;

import com.netaudit.model.ComplianceRule;
import com.netaudit.parser.GoldenTemplateParser;
import com.netaudit.rule.matcher.RuleMatcher.MatchOutcome;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegexRuleMatcherTest {

    private final RegexRuleMatcher matcher = new RegexRuleMatcher();
    private final GoldenTemplateParser parser = new GoldenTemplateParser();

    private ComplianceRule rule(String pattern) {
        return parser.parse("""
                golden_config:
                  global_config:
                    - pattern: '%s'
                      description: "test rule"
                """.formatted(pattern)).allRules().get(0);
    }

    @Test
    void shouldFindSubstringAnywhereInConfig() {
        MatchOutcome outcome = matcher.evaluate(rule("enable secret"),
                "hostname R1\n!\nenable secret 5 $1$abc\n!\nend");

        assertTrue(outcome.found());
        assertEquals("enable secret", outcome.matchedText());
    }

    @Test
    void shouldSupportAlternation() {
        ComplianceRule routing = rule("router ospf|router eigrp|router bgp");

        assertTrue(matcher.evaluate(routing, "interface Gi0/0\nrouter bgp 65000\n neighbor 1.1.1.1").found());
        assertFalse(matcher.evaluate(routing, "ip route 0.0.0.0 0.0.0.0 10.0.0.1").found());
    }

    @Test
    void shouldBeCaseSensitive() {
        assertFalse(matcher.evaluate(rule("ntp server"), "NTP SERVER 10.0.0.1").found());
    }

    @Test
    void shouldNotRequireFullLineMatch() {
        MatchOutcome outcome = matcher.evaluate(rule("username .* privilege 15"),
                "username admin privilege 15 secret 5 xyz");

        assertTrue(outcome.found());
        assertEquals("username admin privilege 15", outcome.matchedText());
    }

    @Test
    void shouldTreatNullConfigAsEmpty() {
        assertEquals(MatchOutcome.notFound(), matcher.evaluate(rule("logging"), null));
        assertFalse(matcher.evaluate(rule("logging"), "").found());
    }
}
