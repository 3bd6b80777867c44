/**
 * Pure Java enums shared across all docfields modules.
 *
 * <p>Labels mirror the wire strings of the document-analysis service.
 * This module has no framework dependencies.
 */
package com.libragraph.docfields.types;
