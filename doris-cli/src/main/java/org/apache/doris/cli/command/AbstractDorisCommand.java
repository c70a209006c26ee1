/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.doris.cli.command;

import org.apache.doris.cli.DorisCliMain;
import org.apache.doris.cli.format.StatusLine;
import org.apache.doris.cli.session.DorisSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base class of the commands that work against a cluster. The command prints a progress line,
 * runs {@link #execute} on a fresh session, and always closes the session afterwards. Failures are
 * reported on the console and never change the exit code.
 */
public abstract class AbstractDorisCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractDorisCommand.class);

    @ParentCommand protected DorisCliMain main;

    /** Message shown while the command runs. */
    protected abstract String progressMessage();

    /** Message shown when the command fails. */
    protected abstract String failureMessage();

    /**
     * Runs the command. Implementations report success on {@code status} before printing their
     * result to {@code out}.
     */
    protected abstract void execute(DorisSession session, StatusLine status, PrintWriter out)
            throws Exception;

    @Override
    public Integer call() {
        StatusLine status = main.newStatusLine();
        PrintWriter err = main.getErr();
        status.start(progressMessage());

        DorisSession session = null;
        try {
            session = main.openSession();
            execute(session, status, main.getOut());
        } catch (Exception e) {
            LOG.debug("Command failed", e);
            status.fail(failureMessage());
            err.println("Error: " + e.getMessage());
            err.flush();
        } finally {
            if (session != null) {
                closeSession(session, err);
            }
        }
        return 0;
    }

    private static void closeSession(DorisSession session, PrintWriter err) {
        try {
            session.close();
        } catch (RuntimeException e) {
            LOG.warn("Failed to close session", e);
            err.println("Error: " + e.getMessage());
            err.flush();
        }
    }
}
