/**
 * Exceptions thrown while decoding, encoding, reading or writing JSON documents.
 */
package works.jsonkeep.exceptions;
