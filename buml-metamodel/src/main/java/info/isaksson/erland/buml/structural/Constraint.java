package info.isaksson.erland.buml.structural;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** A constraint on a class, written as an expression in some language (typically OCL). */
public class Constraint extends NamedElement {

    private Class context;
    private String expression;
    private String language;

    public Constraint(String name, Class context, String expression, String language) {
        this(name, context, expression, language, null, null);
    }

    public Constraint(String name, Class context, String expression, String language,
                      Instant timestamp, List<String> synonyms) {
        super(name, timestamp, synonyms, Visibility.PUBLIC);
        setContext(context);
        setExpression(expression);
        setLanguage(language);
    }

    public Class getContext() {
        return context;
    }

    public void setContext(Class context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public String getExpression() {
        return expression;
    }

    public void setExpression(String expression) {
        this.expression = expression;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
