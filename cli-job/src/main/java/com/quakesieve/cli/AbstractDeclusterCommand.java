package com.quakesieve.cli;

import com.quakesieve.core.config.DeclusterConfig;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base of the declustering subcommands: each subclass describes its method
 * as a {@link DeclusterConfig}; this class runs the job and reports the
 * output counts on standard output.
 */
abstract class AbstractDeclusterCommand implements Callable<Integer> {

    @Mixin
    CommonOptions common;

    @Spec
    CommandSpec spec;

    /**
     * @return the declustering configuration for this command
     * @throws Exception if the configuration cannot be obtained
     */
    protected abstract DeclusterConfig configure() throws Exception;

    @Override
    public Integer call() throws Exception {
        JobConfig job = common.toJobConfig(configure());
        RunSummary summary = new DeclusterJob(job).run();

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Wrote %d mainshocks to %s%n", summary.getIndependent(), job.getMainshocks());
        out.printf("Wrote %d aftershocks to %s%n", summary.getDependent(), job.getAftershocks());
        if (summary.getRecordsRejected() > 0) {
            out.printf("Dropped %d invalid record(s)%n", summary.getRecordsRejected());
        }
        out.flush();
        return 0;
    }
}
