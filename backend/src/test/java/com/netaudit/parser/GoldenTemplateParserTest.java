package com.netaudit.parser;

import com.netaudit.model.ComplianceRule;
import com.netaudit.model.ComplianceRule.RuleKind;
import com.netaudit.model.ComplianceRule.Scope;
import com.netaudit.model.ComplianceRule.Severity;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.parser.TemplateException.Reason;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GoldenTemplateParserTest {

    private final GoldenTemplateParser parser = new GoldenTemplateParser();

    @Test
    void shouldParseGroupsAndForbiddenRules() {
        String yaml = """
                golden_config:
                  name: "Test Template"
                  version: "2.1"
                  global_config:
                    - pattern: "enable secret"
                      description: "Configure enable secret"
                      severity: high
                    - pattern: "ip http secure-server"
                      description: "Enable HTTPS server only"
                      required: false
                      severity: "MEDIUM"
                  line_config:
                    - name: ssh_only
                      pattern: "transport input ssh"
                      description: "Enable SSH access only"
                      required: true
                      severity: "LOW"
                forbidden_config:
                  - pattern: "transport input telnet"
                    description: "Telnet should be disabled"
                    required: true
                    severity: "HIGH"
                """;

        ComplianceTemplate template = parser.parse(yaml);

        assertEquals("Test Template", template.name());
        assertEquals("2.1", template.version());
        assertEquals(2, template.groups().size());
        assertEquals("global_config", template.groups().get(0).key());
        assertEquals(Scope.LINE, template.groups().get(1).scope());
        assertEquals(4, template.ruleCount());

        ComplianceRule secret = template.groups().get(0).rules().get(0);
        assertEquals("global_config.1", secret.getName());
        assertEquals(Severity.HIGH, secret.getSeverity());
        assertEquals(RuleKind.REQUIRED, secret.getKind());
        assertEquals(Scope.GLOBAL, secret.getScope());
        assertNotNull(secret.getCompiledPattern());

        assertEquals(RuleKind.OPTIONAL, template.groups().get(0).rules().get(1).getKind());
        assertTrue(template.findRule("ssh_only").isPresent());

        ComplianceRule telnet = template.forbiddenGroup().rules().get(0);
        assertEquals("forbidden_config.1", telnet.getName());
        assertEquals(RuleKind.FORBIDDEN, telnet.getKind());
        assertEquals(Scope.FORBIDDEN, telnet.getScope());
        assertTrue(telnet.isForbidden());
        assertFalse(telnet.isRequired());
    }

    @Test
    void shouldKeepEvaluationOrderWithForbiddenLast() {
        String yaml = """
                golden_config:
                  forbidden_config:
                    - pattern: "enable password"
                      description: "Plain text enable password"
                  security_config:
                    - pattern: "access-list"
                      description: "Configure ACLs"
                forbidden_config:
                  - pattern: "transport input telnet"
                    description: "Telnet should be disabled"
                """;

        ComplianceTemplate template = parser.parse(yaml);

        List<String> names = template.allRules().stream().map(ComplianceRule::getName).toList();
        assertEquals(List.of("security_config.1", "forbidden_config.1", "forbidden_config.2"), names);
        assertEquals("enable password", template.forbiddenGroup().rules().get(0).getPattern());
    }

    @Test
    void shouldDefaultMissingSeverityAndRequired() {
        ComplianceTemplate template = parser.parse("""
                golden_config:
                  global_config:
                    - pattern: "ntp server"
                      description: "Configure NTP server"
                """);

        ComplianceRule rule = template.allRules().get(0);
        assertEquals(Severity.HIGH, rule.getSeverity());
        assertTrue(rule.isRequired());
        assertEquals("unnamed", template.name());
        assertTrue(template.forbiddenGroup().rules().isEmpty());
    }

    @Test
    void shouldRejectMissingPattern() {
        TemplateException e = assertThrows(TemplateException.class, () -> parser.parse("""
                golden_config:
                  global_config:
                    - pattern: "ntp server"
                      description: "Configure NTP server"
                    - description: "No pattern here"
                      severity: LOW
                """));

        assertEquals(Reason.MISSING_FIELD, e.getReason());
        assertEquals("global_config", e.getGroup());
        assertEquals("#2", e.getRuleRef());
    }

    @Test
    void shouldRejectEmptyPatternAndMissingDescription() {
        TemplateException empty = assertThrows(TemplateException.class, () -> parser.parse("""
                golden_config:
                  global_config:
                    - pattern: ""
                      description: "Empty"
                """));
        assertEquals(Reason.MISSING_FIELD, empty.getReason());

        TemplateException noDescription = assertThrows(TemplateException.class, () -> parser.parse("""
                forbidden_config:
                  - pattern: "enable password"
                golden_config:
                  global_config: []
                """));
        assertEquals(Reason.MISSING_FIELD, noDescription.getReason());
        assertEquals("forbidden_config", noDescription.getGroup());
    }

    @Test
    void shouldRejectUnknownSeverity() {
        TemplateException e = assertThrows(TemplateException.class, () -> parser.parse("""
                golden_config:
                  line_config:
                    - name: timeout
                      pattern: "exec-timeout"
                      description: "Configure session timeout"
                      severity: CRITICAL
                """));

        assertEquals(Reason.INVALID_SEVERITY, e.getReason());
        assertEquals("timeout", e.getRuleRef());
        assertTrue(e.getMessage().contains("CRITICAL"));
    }

    @Test
    void shouldRejectInvalidPattern() {
        TemplateException e = assertThrows(TemplateException.class, () -> parser.parse("""
                golden_config:
                  security_config:
                    - pattern: "username (.* privilege 15"
                      description: "Privileged users"
                """));

        assertEquals(Reason.INVALID_PATTERN, e.getReason());
        assertEquals("security_config", e.getGroup());
    }

    @Test
    void shouldRejectDuplicateNames() {
        TemplateException e = assertThrows(TemplateException.class, () -> parser.parse("""
                golden_config:
                  global_config:
                    - name: ntp
                      pattern: "ntp server"
                      description: "Configure NTP server"
                  line_config:
                    - name: ntp
                      pattern: "ntp"
                      description: "Again"
                """));

        assertEquals(Reason.DUPLICATE_NAME, e.getReason());
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertEquals(Reason.MALFORMED_DOCUMENT,
                assertThrows(TemplateException.class, () -> parser.parse("")).getReason());
        assertEquals(Reason.MALFORMED_DOCUMENT,
                assertThrows(TemplateException.class, () -> parser.parse("rules: []")).getReason());
        assertEquals(Reason.MALFORMED_DOCUMENT,
                assertThrows(TemplateException.class, () -> parser.parse("golden_config: [1, 2")).getReason());
        assertEquals(Reason.MALFORMED_DOCUMENT,
                assertThrows(TemplateException.class, () -> parser.parse("""
                        golden_config:
                          global_config: "not a list"
                        """)).getReason());
        assertEquals(Reason.MALFORMED_DOCUMENT,
                assertThrows(TemplateException.class, () -> parser.parse("""
                        golden_config:
                          global_config:
                            - "just a string"
                        """)).getReason());
    }

    @Test
    void shouldLoadBundledCiscoTemplate() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/templates/cisco_ios_golden_config.yaml")) {
            assertNotNull(in);
            ComplianceTemplate template = parser.parse(in);

            assertEquals("Cisco IOS Standard Configuration", template.name());
            assertEquals("1.0", template.version());
            assertEquals(5, template.groups().size());
            assertEquals(3, template.forbiddenGroup().size());
            assertEquals(18, template.ruleCount());
            assertEquals(Scope.ROUTING, template.groups().get(4).scope());
        }
    }
}
