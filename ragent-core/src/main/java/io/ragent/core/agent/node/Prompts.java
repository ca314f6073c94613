package io.ragent.core.agent.node;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class Prompts {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    static final String GRADE = """
        You are a grader assessing relevance of retrieved docs to a user question.
        Here are the retrieved docs:
        -------
        {context}
        -------
        Here is the user question: {question}
        If the content of the docs is relevant to the user's question, score them as relevant.
        Give a binary score 'yes' or 'no' to indicate whether the docs are relevant to the question.
        Yes: The docs are relevant to the question.
        No: The docs are not relevant to the question.""";

    static final String REWRITE = """
        Look at the input and try to reason about the underlying semantic intent / meaning.
        Here is the initial question:
        -------
        {question}
        -------
        Formulate an improved question:""";

    static final String GENERATE = """
        You are an assistant for question-answering tasks.
        Use the following pieces of retrieved context to answer the question.
        If you don't know the answer, just say that you don't know.
        Use three sentences maximum and keep the answer concise.
        Question: {question}
        Context: {context}""";

    private Prompts() {
    }

    /** Substitutes {@code {name}} placeholders in one pass; values are never re-scanned. */
    static String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement = values.containsKey(key)
                ? Objects.toString(values.get(key), "")
                : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
