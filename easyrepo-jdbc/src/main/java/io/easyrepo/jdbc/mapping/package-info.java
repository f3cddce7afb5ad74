/**
 * Explicit entity-to-table mappings: columns, constraints and associations.
 */
package io.easyrepo.jdbc.mapping;
