package com.pagereader.core.correction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Частые контекстные ошибки OCR: "в нес" → "в нее". Поиск без учёта регистра, по подстроке. */
public final class ContextPass implements CorrectionPass {
    /** "ве" ищется как подстрока и срабатывает внутри слов ("Привет"); таблица настраивается. */
    public static final Map<String, String> DEFAULT_PHRASES;
    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("в нес", "в нее");
        m.put("на нес", "на нее");
        m.put("к неи", "к ней");
        m.put("из нес", "из нее");
        m.put("для нес", "для нее");
        m.put("ве", "её");
        m.put("кнам", "к нам");
        DEFAULT_PHRASES = Collections.unmodifiableMap(m);
    }

    private record Rule(Pattern wrong, String correct) {}

    private final List<Rule> rules;

    public ContextPass() {
        this(DEFAULT_PHRASES);
    }

    /** @param phrases неверная фраза → верная; порядок проверки = порядок итерации карты */
    public ContextPass(Map<String, String> phrases) {
        List<Rule> list = new ArrayList<>();
        phrases.forEach((wrong, correct) -> {
            if (wrong == null || wrong.isEmpty()) return;
            list.add(new Rule(
                    Pattern.compile(Pattern.quote(wrong), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    correct == null ? "" : correct));
        });
        this.rules = List.copyOf(list);
    }

    @Override
    public IssueKind kind() {
        return IssueKind.CONTEXT;
    }

    @Override
    public List<CorrectionIssue> find(String text) {
        List<CorrectionIssue> out = new ArrayList<>();
        for (Rule r : rules) {
            Matcher m = r.wrong().matcher(text);
            while (m.find()) {
                String hit = m.group();
                out.add(CorrectionIssue.of(IssueKind.CONTEXT, hit, r.correct(), hit,
                        "Context: \"" + hit + "\" → \"" + r.correct() + "\"", ReplacementPolicy.REPLACE_ALL));
            }
        }
        return out;
    }
}
