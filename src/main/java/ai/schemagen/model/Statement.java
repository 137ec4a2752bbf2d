package ai.schemagen.model;

import java.util.List;

/**
 * Raw vocabulary statement, as read from the input document.
 */
public sealed interface Statement
        permits Statement.ClassStatement, Statement.PropertyStatement, Statement.InstanceStatement {

    String name();

    /**
     * Class declaration; a null parent list reads as no parents.
     */
    record ClassStatement(
            String name,
            List<String> parents,
            String comment
    ) implements Statement {
        public ClassStatement {
            parents = parents == null ? List.of() : List.copyOf(parents);
        }
    }

    record PropertyStatement(
            String name,
            List<String> domains,
            List<String> ranges,
            String comment,
            String supersededBy // null unless deprecated
    ) implements Statement {
        public PropertyStatement {
            if (domains == null || ranges == null) {
                throw new MalformedStatementException("Property " + name + " needs domains and ranges");
            }
            domains = List.copyOf(domains);
            ranges = List.copyOf(ranges);
        }
    }

    /**
     * Enumeration member: {@code name} is a declared value of class {@code type}.
     */
    record InstanceStatement(
            String name,
            String type
    ) implements Statement {
    }
}
