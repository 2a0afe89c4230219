/*
 * PDF-TagSynth - Accessibility Structure-Tree Synthesis
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.tagsynth.ui;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.pdf.tagsynth.core.Checkpoint;
import net.boyechko.pdf.tagsynth.core.ProcessingListener;
import net.boyechko.pdf.tagsynth.issue.Diagnostic;
import net.boyechko.pdf.tagsynth.issue.DiagnosticList;
import net.boyechko.pdf.tagsynth.issue.DiagnosticSev;
import org.slf4j.LoggerFactory;

/** A {@link ProcessingListener} that routes all events through SLF4J. */
public class LoggingListener implements ProcessingListener {

    private static final String CONSOLE_APPENDER_NAME = "TAGSYNTH_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.pdf.tagsynth.processing");

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stdout. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-30logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(String message) {
        logger.warn("{}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onCheckpoint(Checkpoint checkpoint, int page) {
        if (page >= 0) {
            logger.debug("CHECKPOINT {} (page {})", checkpoint, page + 1);
        } else {
            logger.info("CHECKPOINT {}", checkpoint);
        }
    }

    @Override
    public void onDiagnosticGroup(String groupLabel, List<Diagnostic> diagnostics) {
        logger.warn("GROUP {} {}", diagnostics.size(), groupLabel);
        for (Diagnostic diagnostic : diagnostics) {
            logger.debug("  {}", diagnostic);
        }
    }

    @Override
    public void onSummary(DiagnosticList allDiagnostics) {
        long warnings =
                allDiagnostics.stream().filter(d -> d.severity() == DiagnosticSev.WARNING).count();
        int errors = allDiagnostics.atLeast(DiagnosticSev.ERROR).size();
        logger.info(
                "SUMMARY diagnostics={} warnings={} errors={}",
                allDiagnostics.size(),
                warnings,
                errors);
    }
}
