package work.lcod.form.support;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import work.lcod.form.model.FormDocument;
import work.lcod.form.parse.FormParser;

/**
 * Shared helpers for the form test suites: fixture loading and small inline forms.
 */
public final class FormFixtures {
    private FormFixtures() {}

    public static String text(String name) {
        try (InputStream in = FormFixtures.class.getResourceAsStream("/forms/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture forms/" + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static FormDocument load(String name) {
        return FormParser.parse(text(name));
    }

    /** Wraps directive text in a form named {@code f}. */
    public static String form(String body) {
        return "{% form id=\"f\" title=\"F\" %}\n\n" + body + "\n{% /form %}\n";
    }

    public static FormDocument parseForm(String body) {
        return FormParser.parse(form(body));
    }
}
