package work.lcod.staging.target;

import java.util.List;

/**
 * The built-in templates used when no template has been registered.
 */
public final class Templates {
    public static final String PROPERTIES_MASK = Template.TARGET_PATTERN + ".properties";
    public static final String XML_PROPERTIES_MASK = Template.TARGET_PATTERN + ".xml";

    public static final Template PROPERTIES = Template.of(PROPERTIES_MASK, Loaders.properties());
    public static final Template XML_PROPERTIES = Template.of(XML_PROPERTIES_MASK, Loaders.xmlProperties());

    public static final List<Template> DEFAULTS = List.of(PROPERTIES, XML_PROPERTIES);

    private Templates() {}

    /** Returns {@code registered} when it holds anything, the built-ins otherwise. */
    public static List<Template> orDefaults(List<Template> registered) {
        return registered == null || registered.isEmpty() ? DEFAULTS : List.copyOf(registered);
    }
}
