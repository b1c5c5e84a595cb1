module com.canary.core {
    // Exports
    exports com.canary.core.model;
    exports com.canary.core.config;
    exports com.canary.core.error;

    // Jackson
    requires transitive com.fasterxml.jackson.databind;
    requires transitive com.fasterxml.jackson.annotation;
    requires com.fasterxml.jackson.dataformat.yaml;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.canary.core.model to com.fasterxml.jackson.databind;
    opens com.canary.core.config to com.fasterxml.jackson.databind;
}
