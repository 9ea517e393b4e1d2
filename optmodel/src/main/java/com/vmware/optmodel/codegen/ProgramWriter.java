/*
 * Copyright 2018-2022 VMware, Inc. All Rights Reserved.
 *
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.optmodel.codegen;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.vmware.optmodel.ModelException;
import freemarker.cache.ClassTemplateLoader;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles declarations and statements into a program, using an Apache FreeMarker template for the
 * {@code proc optmodel;} ... {@code quit;} envelope. The body is indented inside the envelope.
 */
public class ProgramWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ProgramWriter.class);
    private static final String PROGRAM_TEMPLATE = "optmodel_program.ftl";
    private final Template template;

    public ProgramWriter() {
        // Freemarker configuration
        final Configuration cfg = new Configuration(Configuration.VERSION_2_3_28);
        final ClassTemplateLoader loader = new ClassTemplateLoader(this.getClass(), "/");
        cfg.setTemplateLoader(loader);
        cfg.setDefaultEncoding("UTF-8");
        try {
            this.template = cfg.getTemplate(PROGRAM_TEMPLATE);
        } catch (final IOException e) {
            throw new ModelException("Program template not found or has formatting errors", e);
        }
    }

    /**
     * @param definitions the rendered statements in program order, each possibly spanning several lines
     * @param header whether to wrap the statements in {@code proc optmodel;} and {@code quit;}
     * @return the program text, without a trailing newline
     */
    public String write(final List<String> definitions, final boolean header) {
        final String body = String.join("\n", definitions);
        final String indented = header ? OptmodelString.indent(body, OptmodelString.INDENT) : body;
        final Map<String, Object> templateVars = new HashMap<>();
        templateVars.put("header", header);
        templateVars.put("lines", body.isEmpty() ? List.of() : Splitter.on('\n').splitToList(indented));
        final StringWriter writer = new StringWriter();
        try {
            template.process(templateVars, writer);
        } catch (final TemplateException | IOException e) {
            throw new ModelException("Error processing template", e);
        }
        final String program = CharMatcher.is('\n').trimTrailingFrom(writer.toString());
        LOG.debug("Generated program:\n{}", program);
        return program;
    }
}
