package com.nginx.log.parser;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import com.nginx.log.error.LineParseException;
import com.nginx.log.parser.model.AccessLogEntry;

/**
 * Pulls line indexes from a shared counter and writes each result into its own
 * slot of the output array, so workers never contend on the output and the batch
 * keeps input order.
 */
class ParseWorker implements Callable<ProcessingStats> {

	private final AccessLogParser parser;
	private final List<String> lines;
	private final AccessLogEntry[] results;
	private final AtomicInteger nextIndex;
	private final AtomicInteger loggedErrors;

	ParseWorker(AccessLogParser parser, List<String> lines, AccessLogEntry[] results,
			AtomicInteger nextIndex, AtomicInteger loggedErrors) {
		this.parser = parser;
		this.lines = lines;
		this.results = results;
		this.nextIndex = nextIndex;
		this.loggedErrors = loggedErrors;
	}

	@Override
	public ProcessingStats call() {
		long parsed = 0;
		long errors = 0;
		int i;
		while ((i = nextIndex.getAndIncrement()) < lines.size()) {
			String line = lines.get(i);
			try {
				results[i] = parser.parseLine(line);
				parsed++;
			} catch (LineParseException e) {
				errors++;
				parser.reportParseError(line, e, loggedErrors);
			}
		}
		return new ProcessingStats(parsed, errors);
	}
}
