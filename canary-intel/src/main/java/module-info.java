module com.canary.intel {
    // Exports
    exports com.canary.intel;
    exports com.canary.intel.model;
    exports com.canary.intel.store;
    exports com.canary.intel.learning;
    exports com.canary.intel.feedback;
    exports com.canary.intel.predict;
    exports com.canary.intel.tracking;
    exports com.canary.intel.report;
    exports com.canary.intel.lock;

    requires transitive com.canary.core;
    requires transitive java.sql;

    // Jackson
    requires com.fasterxml.jackson.datatype.jsr310;

    // SQLite
    requires org.xerial.sqlitejdbc;

    // Logging
    requires org.slf4j;

    // Jackson reflection access
    opens com.canary.intel to com.fasterxml.jackson.databind;
    opens com.canary.intel.model to com.fasterxml.jackson.databind;
    opens com.canary.intel.predict to com.fasterxml.jackson.databind;
    opens com.canary.intel.tracking to com.fasterxml.jackson.databind;
    opens com.canary.intel.report to com.fasterxml.jackson.databind;
    opens com.canary.intel.feedback to com.fasterxml.jackson.databind;
    opens com.canary.intel.lock to com.fasterxml.jackson.databind;
}
