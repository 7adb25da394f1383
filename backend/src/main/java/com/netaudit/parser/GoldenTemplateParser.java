package com.netaudit.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.netaudit.model.ComplianceRule;
import com.netaudit.model.ComplianceRule.RuleKind;
import com.netaudit.model.ComplianceRule.Scope;
import com.netaudit.model.ComplianceRule.Severity;
import com.netaudit.model.ComplianceTemplate;
import com.netaudit.model.RuleGroup;
import com.netaudit.parser.TemplateException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 黄金配置模板解析器
 * <p>
 * 将 YAML 模板解析为不可变的 {@link ComplianceTemplate}。支持的文档结构:
 * <pre>
 * golden_config:
 *   name: "..."
 *   version: "1.0"
 *   global_config:
 *     - pattern: "enable secret"
 *       description: "..."
 *       required: true
 *       severity: HIGH
 * forbidden_config:
 *   - pattern: "transport input telnet"
 *     description: "..."
 *     severity: HIGH
 * </pre>
 * golden_config 下所有列表类型的键都视为规则分组；forbidden_config 中的规则一律按禁止规则处理。
 * 解析器本身不读取文件，只处理调用方传入的文本或流。
 */
@Component
public class GoldenTemplateParser {

    private static final Logger log = LoggerFactory.getLogger(GoldenTemplateParser.class);

    public static final String ROOT_KEY = "golden_config";
    public static final String FORBIDDEN_KEY = "forbidden_config";

    private static final Set<String> METADATA_KEYS = Set.of("name", "version", "description");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ComplianceTemplate parse(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            throw new TemplateException(Reason.MALFORMED_DOCUMENT, null, null, "模板内容为空");
        }
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (IOException e) {
            throw TemplateException.malformed("无法解析 YAML 模板: " + e.getMessage(), e);
        }
        return build(root);
    }

    public ComplianceTemplate parse(InputStream inputStream) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(inputStream);
        } catch (IOException e) {
            throw TemplateException.malformed("无法解析 YAML 模板: " + e.getMessage(), e);
        }
        return build(root);
    }

    private ComplianceTemplate build(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new TemplateException(Reason.MALFORMED_DOCUMENT, null, null, "模板根节点必须是映射");
        }
        JsonNode golden = root.get(ROOT_KEY);
        if (golden == null || !golden.isObject()) {
            throw new TemplateException(Reason.MALFORMED_DOCUMENT, null, null,
                    "模板缺少 " + ROOT_KEY + " 根节点");
        }

        Set<String> names = new HashSet<>();
        List<RuleGroup> groups = new ArrayList<>();
        List<JsonNode> forbiddenEntries = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = golden.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (METADATA_KEYS.contains(key) && !value.isArray()) {
                continue;
            }
            if (FORBIDDEN_KEY.equals(key)) {
                collectForbidden(value, key, forbiddenEntries);
                continue;
            }
            if (value.isNull()) {
                // 空分组，例如只写了键名
                groups.add(RuleGroup.empty(key, Scope.fromGroupKey(key)));
                continue;
            }
            if (!value.isArray()) {
                throw new TemplateException(Reason.MALFORMED_DOCUMENT, key, null,
                        "分组 " + key + " 必须是规则列表");
            }
            groups.add(parseGroup(key, value, names));
        }

        JsonNode topForbidden = root.get(FORBIDDEN_KEY);
        if (topForbidden != null) {
            collectForbidden(topForbidden, FORBIDDEN_KEY, forbiddenEntries);
        }
        RuleGroup forbidden = parseForbidden(forbiddenEntries, names);

        ComplianceTemplate template = new ComplianceTemplate(
                text(golden, "name", "unnamed"),
                text(golden, "version", "0"),
                text(golden, "description", ""),
                groups,
                forbidden);
        log.info("加载模板 {} v{}: {} 个分组, {} 条规则, {} 条禁止规则",
                template.name(), template.version(), groups.size(),
                template.ruleCount(), forbidden.size());
        return template;
    }

    private RuleGroup parseGroup(String key, JsonNode entries, Set<String> names) {
        Scope scope = Scope.fromGroupKey(key);
        List<ComplianceRule> rules = new ArrayList<>();
        int position = 0;
        for (JsonNode entry : entries) {
            position++;
            boolean required = !entry.isObject() || !entry.hasNonNull("required")
                    || entry.get("required").asBoolean(true);
            RuleKind kind = required ? RuleKind.REQUIRED : RuleKind.OPTIONAL;
            rules.add(parseRule(entry, key, position, kind, scope, names));
        }
        return new RuleGroup(key, scope, rules);
    }

    private RuleGroup parseForbidden(List<JsonNode> entries, Set<String> names) {
        List<ComplianceRule> rules = new ArrayList<>();
        int position = 0;
        for (JsonNode entry : entries) {
            position++;
            // required 字段在禁止分组中无意义，直接忽略
            rules.add(parseRule(entry, FORBIDDEN_KEY, position, RuleKind.FORBIDDEN, Scope.FORBIDDEN, names));
        }
        return new RuleGroup(FORBIDDEN_KEY, Scope.FORBIDDEN, rules);
    }

    private void collectForbidden(JsonNode value, String key, List<JsonNode> sink) {
        if (value.isNull()) {
            return;
        }
        if (!value.isArray()) {
            throw new TemplateException(Reason.MALFORMED_DOCUMENT, key, null, key + " 必须是规则列表");
        }
        value.forEach(sink::add);
    }

    private ComplianceRule parseRule(JsonNode entry, String group, int position, RuleKind kind,
                                     Scope scope, Set<String> names) {
        if (!entry.isObject()) {
            throw new TemplateException(Reason.MALFORMED_DOCUMENT, group, "#" + position,
                    describe(group, "#" + position) + " 必须是映射");
        }

        String declaredName = text(entry, "name", null);
        boolean named = declaredName != null && !declaredName.isBlank();
        String name = named ? declaredName : group + "." + position;
        String ref = named ? declaredName : "#" + position;

        String pattern = text(entry, "pattern", null);
        if (pattern == null || pattern.isEmpty()) {
            throw new TemplateException(Reason.MISSING_FIELD, group, ref,
                    describe(group, ref) + " 缺少 pattern");
        }
        String description = text(entry, "description", null);
        if (description == null || description.isBlank()) {
            throw new TemplateException(Reason.MISSING_FIELD, group, ref,
                    describe(group, ref) + " 缺少 description");
        }

        Severity severity = Severity.HIGH;
        String rawSeverity = text(entry, "severity", null);
        if (rawSeverity != null) {
            Optional<Severity> parsed = Severity.parse(rawSeverity);
            if (parsed.isEmpty()) {
                throw new TemplateException(Reason.INVALID_SEVERITY, group, ref,
                        describe(group, ref) + " 的 severity 无效: " + rawSeverity + "（可选值 HIGH, MEDIUM, LOW）");
            }
            severity = parsed.get();
        }

        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new TemplateException(Reason.INVALID_PATTERN, group, ref,
                    describe(group, ref) + " 的 pattern 不是合法的正则表达式: " + e.getDescription(), e);
        }

        if (!names.add(name)) {
            throw new TemplateException(Reason.DUPLICATE_NAME, group, ref,
                    describe(group, ref) + " 的规则名重复: " + name);
        }

        return ComplianceRule.builder()
                .name(name)
                .description(description)
                .pattern(pattern)
                .compiledPattern(compiled)
                .kind(kind)
                .severity(severity)
                .scope(scope)
                .group(group)
                .build();
    }

    private static String describe(String group, String ref) {
        return "分组 " + group + " 的规则 " + ref;
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return fallback;
        }
        return value.asText();
    }
}
