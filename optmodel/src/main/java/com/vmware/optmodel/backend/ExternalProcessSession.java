/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.backend;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.vmware.optmodel.SolverException;
import org.apache.commons.text.StringEscapeUtils;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Runs programs through an external command. The program is written to a temporary file whose path is
 * appended to the command line. The command prints one CSV table per section, each introduced by a tag
 * line:
 *
 * <pre>
 * !!PRIMAL
 * var,value,rc
 * x,2,0
 * !!DUAL
 * con,value,dual
 * c1,2,0.5
 * !!SUMMARY
 * key,value
 * status,OPTIMAL
 * objective,4
 * time,0.01
 * </pre>
 */
public class ExternalProcessSession implements ISolverSession {
    private static final Logger LOG = LoggerFactory.getLogger(ExternalProcessSession.class);
    static final String OUTPUT_TABLENAME_TAG = "\n!!";
    static final String PRIMAL_TABLE = "PRIMAL";
    static final String DUAL_TABLE = "DUAL";
    static final String SUMMARY_TABLE = "SUMMARY";
    private static final char CSV_DELIMITER = ',';
    private final List<String> command;
    private final DSLContext dslContext = DSL.using(SQLDialect.DEFAULT);

    /**
     * @param command the executable and its arguments
     */
    public ExternalProcessSession(final List<String> command) {
        Preconditions.checkArgument(!command.isEmpty(), "No command to run");
        this.command = ImmutableList.copyOf(command);
    }

    @Override
    public SolverResponse submit(final String program) {
        final File programFile;
        final File stdout;
        final File stderr;
        try {
            programFile = File.createTempFile("optmodel", ".sas");
            programFile.deleteOnExit();
            stdout = File.createTempFile("optmodel", "-out");
            stdout.deleteOnExit();
            stderr = File.createTempFile("optmodel", "-err");
            stderr.deleteOnExit();
            Files.writeString(programFile.toPath(), program, UTF_8);
        } catch (final IOException e) {
            throw new SolverException("Could not write the program file", e);
        }
        final List<String> commandLine = new ArrayList<>(command);
        commandLine.add(programFile.getAbsolutePath());
        final ProcessBuilder pb = new ProcessBuilder(commandLine);
        LOG.info("Running command {}", pb.command());
        final long start = System.nanoTime();
        final Process process;
        try {
            process = pb.redirectError(stderr).redirectOutput(stdout).start();
        } catch (final IOException e) {
            throw new SolverException("Could not execute " + command.get(0), e);
        }
        try {
            process.waitFor();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("Solver process was interrupted", e);
        }
        LOG.info("Solver command completed in {}ns. Parsing output.", System.nanoTime() - start);
        if (process.exitValue() != 0) {
            throw new SolverException(String.format("%s exited with error code %d:%n%s", command.get(0),
                                                    process.exitValue(), readLines(stderr, "\n")));
        }
        // adds an empty line so we can then split by OUTPUT_TABLENAME_TAG
        return parseOutput("\n" + readLines(stdout, "\n"));
    }

    private static String readLines(final File file, final String separator) {
        final StringJoiner output = new StringJoiner(separator);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                // ignore empty lines (includes whitespace-only lines)
                if (line.trim().length() <= 0) {
                    continue;
                }
                output.add(line);
            }
        } catch (final IOException e) {
            throw new SolverException("Could not read solver output", e);
        }
        return output.toString();
    }

    /**
     * Splits the output into one CSV per tagged table
     */
    SolverResponse parseOutput(final String output) {
        final SolverResponse.Builder builder = new SolverResponse.Builder();
        for (final String tableLine : Splitter.on(OUTPUT_TABLENAME_TAG).omitEmptyStrings().split(output)) {
            final List<String> tableParts = Splitter.on("\n").limit(2).splitToList(tableLine);
            if (tableParts.size() < 2) {
                throw new SolverException("Mal-formed output for table " + tableParts.get(0));
            }
            final String tableName = tableParts.get(0).trim();
            final Result<Record> records = dslContext.fetchFromCSV(tableParts.get(1), true, CSV_DELIMITER);
            switch (tableName) {
                case PRIMAL_TABLE:
                    builder.setPrimal(records);
                    break;
                case DUAL_TABLE:
                    builder.setDual(records);
                    break;
                case SUMMARY_TABLE:
                    applySummary(builder, records);
                    break;
                default:
                    LOG.warn("Ignoring unknown table {} tagged by {}", tableName,
                             StringEscapeUtils.escapeJava(OUTPUT_TABLENAME_TAG));
            }
        }
        return builder.build();
    }

    private static void applySummary(final SolverResponse.Builder builder, final Result<Record> summary) {
        for (final Record row : summary) {
            final String key = String.valueOf(row.get(0)).trim();
            final String value = String.valueOf(row.get(1)).trim();
            switch (key) {
                case "status":
                    builder.setStatus(value);
                    break;
                case "objective":
                    builder.setObjectiveValue(Double.valueOf(value));
                    break;
                case "time":
                    builder.setSolutionTime(Double.parseDouble(value));
                    break;
                default:
                    LOG.debug("Ignoring summary entry {}={}", key, value);
            }
        }
    }

    @Override
    public String toString() {
        return "ExternalProcessSession{" +
                "command=" + String.join(" ", command) +
                '}';
    }
}
