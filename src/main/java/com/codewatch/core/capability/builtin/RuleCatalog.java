package com.codewatch.core.capability.builtin;

import com.codewatch.core.model.FindingCategory;
import com.codewatch.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Built-in detection rules for Python sources.
 */
public final class RuleCatalog {

    private RuleCatalog() {}

    private static final Pattern FSTRING_EXECUTE =
            Pattern.compile("(\\.execute(?:many)?\\s*\\(\\s*)f([\"'])(.*?)\\2\\s*\\)");
    private static final Pattern FSTRING_PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");
    private static final Pattern SECRET_ASSIGNMENT =
            Pattern.compile("^(\\s*)(\\w+)\\s*=\\s*[\"'][^\"']*[\"']\\s*$");

    public static final List<PatternRule> SECURITY = List.of(
        new PatternRule("sql_injection", FindingCategory.SECURITY, Severity.CRITICAL,
            Pattern.compile("\\.execute(?:many)?\\s*\\(\\s*(?:f[\"']|[\"'][^\"']*[\"']\\s*(?:%|\\+|\\.format))"),
            "SQL injection",
            "SQL query is built from string interpolation; user input can alter the statement.",
            0.9, RuleCatalog::parameterizeQuery,
            "Use a parameterized query so the driver escapes values."),
        new PatternRule("command_injection", FindingCategory.SECURITY, Severity.CRITICAL,
            Pattern.compile("\\bos\\.(?:system|popen)\\s*\\("),
            "Command injection",
            "Shell command executed through os.system/os.popen; arguments reach the shell unescaped.",
            0.85, line -> line.replaceFirst("\\bos\\.(?:system|popen)\\s*\\((.*)\\)",
                    "subprocess.run(shlex.split($1), check=True)"),
            "Run the command without a shell, passing arguments as a list."),
        new PatternRule("command_injection", FindingCategory.SECURITY, Severity.HIGH,
            Pattern.compile("\\bsubprocess\\.\\w+\\s*\\(.*shell\\s*=\\s*True"),
            "Command injection via shell=True",
            "subprocess invoked with shell=True; arguments are interpreted by the shell.",
            0.85, line -> line.replaceFirst("shell\\s*=\\s*True", "shell=False"),
            "Disable shell interpretation."),
        new PatternRule("code_injection", FindingCategory.SECURITY, Severity.HIGH,
            Pattern.compile("(?<![\\w.])(?:eval|exec)\\s*\\("),
            "Dynamic code execution",
            "eval/exec executes arbitrary code built at runtime.",
            0.8, line -> line.replaceFirst("(?<![\\w.])eval\\s*\\(", "ast.literal_eval("),
            "ast.literal_eval only evaluates literals."),
        new PatternRule("hardcoded_secret", FindingCategory.SECURITY, Severity.HIGH,
            Pattern.compile("(?i)\\b\\w*(?:password|passwd|secret|api_key|apikey|token)\\w*\\s*=\\s*[\"'][^\"']{4,}[\"']"),
            "Hardcoded secret",
            "Credential literal committed in source.",
            0.75, RuleCatalog::readSecretFromEnvironment,
            "Read the secret from the environment."),
        new PatternRule("insecure_deserialization", FindingCategory.SECURITY, Severity.HIGH,
            Pattern.compile("\\bpickle\\.loads?\\s*\\(|\\byaml\\.load\\s*\\((?!.*SafeLoader)"),
            "Insecure deserialization",
            "Deserializing untrusted data can execute arbitrary code.",
            0.85, line -> line.contains("yaml.load")
                    ? line.replaceFirst("\\byaml\\.load\\s*\\(", "yaml.safe_load(") : null,
            "yaml.safe_load only constructs plain data."),
        new PatternRule("weak_crypto", FindingCategory.SECURITY, Severity.MEDIUM,
            Pattern.compile("\\bhashlib\\.(?:md5|sha1)\\s*\\("),
            "Weak hash algorithm",
            "MD5 and SHA-1 are broken for security purposes.",
            0.7, line -> line.replaceFirst("\\bhashlib\\.(?:md5|sha1)\\s*\\(", "hashlib.sha256("),
            "Use SHA-256.")
    );

    public static final List<PatternRule> BUG = List.of(
        new PatternRule("bare_except", FindingCategory.BUG, Severity.MEDIUM,
            Pattern.compile("^\\s*except\\s*:"),
            "Bare except",
            "A bare except also catches SystemExit and KeyboardInterrupt.",
            0.8, line -> line.replaceFirst("except\\s*:", "except Exception:"),
            "Catch Exception instead of everything."),
        new PatternRule("mutable_default_argument", FindingCategory.BUG, Severity.MEDIUM,
            Pattern.compile("^\\s*def\\s+\\w+\\s*\\(.*=\\s*(?:\\[\\s*]|\\{\\s*}|set\\(\\s*\\))"),
            "Mutable default argument",
            "Default values are shared across calls; mutations leak between invocations.",
            0.85, line -> line.replaceAll("=\\s*(?:\\[\\s*]|\\{\\s*}|set\\(\\s*\\))", "=None"),
            "Default to None and create the container inside the function."),
        new PatternRule("none_comparison", FindingCategory.BUG, Severity.LOW,
            Pattern.compile("[=!]=\\s*None\\b"),
            "Comparison to None with ==",
            "Equality operators can be overridden; identity comparison is reliable.",
            0.9, line -> line.replaceAll("!=\\s*None\\b", "is not None").replaceAll("==\\s*None\\b", "is None"),
            "Compare to None with is / is not."),
        new PatternRule("resource_leak", FindingCategory.BUG, Severity.MEDIUM,
            Pattern.compile("^\\s*\\w+\\s*=\\s*open\\s*\\("),
            "File opened without context manager",
            "The file handle is not closed if an exception occurs.",
            0.6, null, null),
        new PatternRule("division_by_zero", FindingCategory.BUG, Severity.MEDIUM,
            Pattern.compile("/\\s*len\\s*\\("),
            "Possible division by zero",
            "Dividing by a length fails on empty collections.",
            0.55, null, null),
        new PatternRule("swallowed_exception", FindingCategory.BUG, Severity.MEDIUM,
            Pattern.compile("^\\s*except\\b.*:\\s*pass\\s*$"),
            "Swallowed exception",
            "The exception is silently discarded.",
            0.7, null, null)
    );

    /** Every rule whose type matches, across all catalogs. */
    public static List<PatternRule> rulesFor(String issueType) {
        return Stream.concat(SECURITY.stream(), BUG.stream())
                .filter(rule -> rule.issueType().equalsIgnoreCase(issueType))
                .collect(Collectors.toList());
    }

    static String parameterizeQuery(String line) {
        Matcher matcher = FSTRING_EXECUTE.matcher(line);
        if (!matcher.find()) {
            return null;
        }
        String quote = matcher.group(2);
        Matcher placeholders = FSTRING_PLACEHOLDER.matcher(matcher.group(3));
        var params = new ArrayList<String>();
        var query = new StringBuilder();
        while (placeholders.find()) {
            params.add(placeholders.group(1).trim());
            placeholders.appendReplacement(query, "?");
        }
        placeholders.appendTail(query);
        if (params.isEmpty()) {
            return null;
        }
        String args = params.size() == 1 ? params.get(0) + "," : String.join(", ", params);
        String replacement = matcher.group(1) + quote + query + quote + ", (" + args + "))";
        return line.substring(0, matcher.start()) + replacement + line.substring(matcher.end());
    }

    static String readSecretFromEnvironment(String line) {
        Matcher matcher = SECRET_ASSIGNMENT.matcher(line);
        if (!matcher.matches()) {
            return null;
        }
        String name = matcher.group(2);
        return matcher.group(1) + name + " = os.environ.get(\"" + name.toUpperCase() + "\")";
    }
}
