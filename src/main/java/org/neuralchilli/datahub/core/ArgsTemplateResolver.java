package org.neuralchilli.datahub.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.*;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.neuralchilli.datahub.domain.Instance;
import org.neuralchilli.datahub.domain.TaskPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@code ${...}} JEXL expressions in task args against the instance
 * being dispatched, e.g. {@code --day=${date.sub(cycleDate, 1, 'days')}}.
 * Text outside expressions, JSON braces included, is kept as-is.
 */
@ApplicationScoped
public class ArgsTemplateResolver {

    private static final Logger log = LoggerFactory.getLogger(ArgsTemplateResolver.class);

    private final JexlEngine jexl;
    private final DateFunctions dateFunctions;

    public ArgsTemplateResolver() {
        this.dateFunctions = new DateFunctions();

        this.jexl = new JexlBuilder()
                .cache(512)
                .strict(true)  // Unknown variables are errors, not empty strings
                .silent(false)
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    /**
     * Args of a Real instance with every expression evaluated; empty for virtual instances.
     *
     * @throws ExpressionException if an expression is unclosed or fails to evaluate
     */
    public String resolve(Instance instance) {
        if (!(instance.payload() instanceof TaskPayload.Real real)) {
            return "";
        }
        return interpolate(real.args(), ArgsContext.of(instance));
    }

    public String interpolate(String template, ArgsContext context) {
        if (template == null || !template.contains("${")) {
            return template;
        }

        JexlContext jexlContext = createJexlContext(context);
        StringBuilder result = new StringBuilder();
        int pos = 0;

        while (pos < template.length()) {
            int start = template.indexOf("${", pos);
            if (start == -1) {
                result.append(template, pos, template.length());
                break;
            }

            // Append text before expression
            result.append(template, pos, start);

            int end = findClosingBrace(template, start + 2);
            if (end == -1) {
                throw new ExpressionException("Unclosed expression in: " + template);
            }

            Object evaluated = evaluate(template.substring(start + 2, end), jexlContext);
            result.append(evaluated != null ? evaluated.toString() : "");

            pos = end + 1;
        }

        return result.toString();
    }

    private Object evaluate(String expression, JexlContext context) {
        try {
            return jexl.createExpression(expression).evaluate(context);
        } catch (Exception e) {
            String msg = String.format("Failed to evaluate expression: ${%s} - %s", expression, e.getMessage());
            log.debug(msg, e);
            throw new ExpressionException(msg, e);
        }
    }

    private int findClosingBrace(String str, int start) {
        int depth = 1;
        for (int i = start; i < str.length(); i++) {
            if (str.charAt(i) == '{') {
                depth++;
            } else if (str.charAt(i) == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JexlContext createJexlContext(ArgsContext context) {
        MapContext jexlContext = new MapContext();

        jexlContext.set("taskId", context.taskId());
        jexlContext.set("taskName", context.taskName());
        jexlContext.set("cycleId", context.cycleId());
        jexlContext.set("period", context.period());
        jexlContext.set("cycle", context.cycle());
        jexlContext.set("cycleDate", context.cycleDate());
        jexlContext.set("attempt", context.attempt());
        jexlContext.set("mirrorId", context.mirrorId());

        jexlContext.set("date", dateFunctions);

        return jexlContext;
    }
}
