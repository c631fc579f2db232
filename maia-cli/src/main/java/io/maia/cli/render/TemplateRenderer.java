package io.maia.cli.render;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;
import io.maia.common.error.TemplateException;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;

/**
 * Renders a decoded JSON tree with a Mustache template given on the command line.
 * Values are written as is; the output is not HTML.
 */
public class TemplateRenderer {

    private final MustacheFactory factory = new DefaultMustacheFactory() {
        @Override
        public void encode(String value, Writer writer) {
            try {
                writer.write(value);
            } catch (IOException e) {
                throw new MustacheException("Failed to write value: " + value, e);
            }
        }
    };

    public String render(String template, Object scope) throws TemplateException {
        try {
            var mustache = factory.compile(new StringReader(template), "template");
            var writer = new StringWriter();
            mustache.execute(writer, scope);
            writer.flush();
            return writer.toString();
        } catch (MustacheException e) {
            throw new TemplateException("invalid template: " + e.getMessage(), e);
        }
    }
}
