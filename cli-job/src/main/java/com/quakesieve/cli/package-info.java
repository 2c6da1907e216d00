/**
 * Command line of the declustering engine: picocli commands, CSV and JSON
 * catalog I/O, and the batch job that ties them to the core engine.
 */
package com.quakesieve.cli;
