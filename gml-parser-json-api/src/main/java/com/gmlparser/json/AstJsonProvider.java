package com.gmlparser.json;

import java.util.ServiceLoader;

/**
 * A JSON binding for the GML AST, found through {@link ServiceLoader}.
 *
 * <p>Putting {@code gml-parser-jackson} on the classpath is enough to make
 * {@link #getProvider()} return its binding:</p>
 * <pre>{@code
 * Program program = GmlParser.parse(source);
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serialize(program);
 * Program copy = json.getDeserializer().deserializeProgram(text);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * @throws IllegalStateException if no binding is on the classpath
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider on the classpath; add gml-parser-jackson or another binding");
    }

    /**
     * The binding whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if none matches
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
