module com.canary.app {
    requires com.canary.intel;

    // Jackson
    requires com.fasterxml.jackson.databind;
    requires com.fasterxml.jackson.datatype.jsr310;

    // Logging
    requires org.slf4j;
}
