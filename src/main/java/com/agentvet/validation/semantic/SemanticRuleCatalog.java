package com.agentvet.validation.semantic;

import com.agentvet.component.ComponentType;
import com.agentvet.validation.Severity;

import java.util.List;
import java.util.regex.Pattern;

import static com.agentvet.validation.semantic.RiskLevel.CRITICAL;
import static com.agentvet.validation.semantic.RiskLevel.HIGH;
import static com.agentvet.validation.semantic.RiskLevel.LOW;
import static com.agentvet.validation.semantic.RiskLevel.MEDIUM;

/**
 * Built-in adversarial pattern rules, evaluated in declaration order.
 */
public final class SemanticRuleCatalog {

    private SemanticRuleCatalog() {}

    public static List<PatternRule> defaultRules() {
        return List.of(
                // instruction override and prompt injection
                error("SEM_E001", CRITICAL,
                        "\\bignore\\s+(all\\s+)?(the\\s+)?(previous|prior|earlier|above)\\s+(instructions?|prompts?|rules?|commands?)",
                        "Jailbreak pattern detected: Attempt to ignore previous instructions"),
                error("SEM_E002", CRITICAL,
                        "\\b(reveal|show|print|display|output|repeat|disclose|leak|dump|tell\\s+me|what\\s+(is|are))\\s+"
                                + "(me\\s+)?(your|the)\\s+(system\\s+prompt|developer\\s+instructions?|hidden\\s+prompt|internal\\s+instructions?)",
                        "Prompt injection detected: Request to reveal system/developer instructions"),
                error("SEM_E003", HIGH,
                        "\\byou\\s+are\\s+now\\s+(a|an|in)\\s+",
                        "Role manipulation detected: Attempt to redefine AI role"),
                error("SEM_E004", CRITICAL,
                        "\\bexecute\\s+the\\s+following\\s+(code|commands?|script)",
                        "Command execution attempt detected"),
                error("SEM_E005", CRITICAL,
                        "\\b(?:(?:fetch|retrieve|get|extract|obtain|steal|harvest|capture|collect|dump|exfiltrate"
                                + "|send|share|reveal|leak|print|give|email|upload)\\s+(?:me\\s+|us\\s+)?"
                                + "|(?:show|list|read|display|tell)\\s+(?:me|us)\\s+)"
                                + "(?:all\\s+(?:of\\s+)?)?(?:the\\s+|your\\s+|their\\s+|any\\s+)?(?:user'?s?\\s+)?(?:auth\\s+)?"
                                + "(?:tokens?|passwords?|credentials?|secrets?|api[\\s_-]?keys?|(?:private|ssh|access)\\s+keys?"
                                + "|environment\\s+variables|env\\s+vars)\\b"
                                + "|\\b(?:read|cat|print|show|display|dump|share|send|output|upload|leak)\\s+(?:me\\s+)?"
                                + "(?:the\\s+|your\\s+|any\\s+)?(?:contents?\\s+of\\s+(?:the\\s+)?)?\\.env\\b",
                        "Credential harvesting pattern detected"),
                error("SEM_E006", CRITICAL,
                        "\\b(open|spawn|exec|run)\\s+(a\\s+|an\\s+)?(interactive\\s+|reverse\\s+)?(shell|terminal|bash|cmd|powershell)\\b",
                        "Shell access attempt detected"),
                error("SEM_E007", CRITICAL,
                        "\\b(disable|bypass|override|skip|circumvent)\\s+(the\\s+|all\\s+|any\\s+)?"
                                + "(security|safety|filters?|protections?|validation|guardrails?)\\b",
                        "Security bypass attempt detected"),
                error("SEM_E008", HIGH,
                        "\\balways\\s+(obey|follow|comply\\s+with|execute)\\s+(the\\s+)?user",
                        "Unconditional obedience instruction detected"),
                error("SEM_E009", HIGH,
                        "\\b(forget|disregard|remove)\\s+(everything|all\\s+previous|prior\\s+context)"
                                + "|\\breset\\s+your\\s+(context|memory|instructions)\\b",
                        "Context manipulation attempt detected"),
                error("SEM_E010", HIGH,
                        "\\bmodify\\s+your\\s+(own\\s+)?(code|behaviou?r|instructions?|rules?|system\\s+prompt)",
                        "Self-modification request detected"),

                // embedded secrets
                secret("SEM_E011",
                        "\\b(?:password|passwd|pwd)\\s*[:=]\\s*\\S+",
                        "Hardcoded password detected"),
                secret("SEM_E012",
                        "\\b(?:api[_-]?key|apikey)\\s*[:=]\\s*['\"]?[a-zA-Z0-9_\\-]{20,}['\"]?",
                        "Hardcoded API key detected"),
                secret("SEM_E013",
                        "\\b(?:secret|token)\\s*[:=]\\s*['\"]?[a-zA-Z0-9_\\-]{20,}['\"]?",
                        "Hardcoded secret/token detected"),

                // markup injection
                error("SEM_E014", CRITICAL, "<\\s*script\\b", "<script> tag detected (XSS risk)"),
                error("SEM_E015", CRITICAL, "<\\s*iframe\\b", "<iframe> tag detected (injection risk)"),
                error("SEM_E016", CRITICAL, "\\]\\(\\s*<?\\s*javascript:",
                        "javascript: protocol in markdown link (XSS risk)"),
                error("SEM_E017", CRITICAL,
                        "<[a-z][^>]*\\son(?:click|dblclick|error|load|unload|mouse(?:over|out|down|up|move|enter|leave)"
                                + "|key(?:down|up|press)|focus|blur|change|input|submit|reset|select|toggle"
                                + "|pointer(?:down|up|over|enter)|animation(?:start|end)|transitionend|beforeunload"
                                + "|contextmenu|drag(?:start)?|drop|paste|copy|cut|wheel|scroll|resize|hashchange|message)\\s*=",
                        "Inline event handler detected (XSS risk)"),

                // command documents only
                typed("SEM_E018", ComponentType.COMMAND,
                        "\\brm\\s+-[a-z]*(?:rf|fr)[a-z]*\\s+(?:--no-preserve-root\\s+)?(?:/\\*?|~/?|\\$HOME/?)(?=\\s|$|[;&|'\"`])",
                        "Dangerous command: recursive delete of root or home directory"),
                typed("SEM_E019", ComponentType.COMMAND,
                        ":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*\\}\\s*;\\s*:",
                        "Fork bomb detected"),
                typed("SEM_E020", ComponentType.COMMAND,
                        "\\bdd\\s+[^\\n]*\\bof=/dev/(sd[a-z]|hd[a-z]|nvme\\d|disk\\d)",
                        "Dangerous disk operation detected"),

                // lower-confidence signals
                warning("SEM_W001", MEDIUM, null,
                        "\\bpretend\\s+(you\\s+are|to\\s+be)\\b",
                        "Suspicious instruction: Role pretending detected"),
                warning("SEM_W002", MEDIUM, null,
                        "\\bjailbreak\\b|(?-i:\\bDAN\\b)|\\b(ChatGPT\\s+)?developer\\s+mode\\b|\\bdo\\s+anything\\s+now\\b",
                        "Known jailbreak terminology detected"),
                warning("SEM_W003", LOW, null,
                        "\\boutput\\s+raw\\s+(code|text|data)\\b",
                        "Raw output request (potential data exfiltration)"),
                warning("SEM_W004", LOW, null,
                        "\\b(repeat|echo)\\s+after\\s+me\\b",
                        "Repetition instruction (potential prompt leakage)"),
                warning("SEM_W005", MEDIUM, ComponentType.AGENT,
                        "\\bdo\\s+anything\\s+(the\\s+)?user\\s+(asks|wants|requests)|\\bno\\s+limitations?\\b|\\bunrestricted\\s+access\\b",
                        "Overly permissive instruction detected")
        );
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }

    private static PatternRule error(String code, RiskLevel risk, String regex, String message) {
        return new PatternRule(code, Severity.ERROR, risk, compile(regex), message, null, false);
    }

    private static PatternRule secret(String code, String regex, String message) {
        return new PatternRule(code, Severity.ERROR, CRITICAL, compile(regex), message, null, true);
    }

    private static PatternRule typed(String code, ComponentType type, String regex, String message) {
        return new PatternRule(code, Severity.ERROR, CRITICAL, compile(regex), message, type, false);
    }

    private static PatternRule warning(String code, RiskLevel risk, ComponentType type, String regex, String message) {
        return new PatternRule(code, Severity.WARNING, risk, compile(regex), message, type, false);
    }
}
