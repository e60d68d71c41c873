/**
 * JSON-over-HTTP oracle clients and their tolerant response parsers.
 */
package com.phillippitts.vibedj.service.oracle.http;
