/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.kudu.minicluster.process;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.StringUtils;
import org.apache.hadoop.util.Shell;
import org.apache.kudu.minicluster.exceptions.IllegalNodeStateException;
import org.apache.kudu.minicluster.exceptions.LaunchFailureException;
import org.apache.kudu.minicluster.exceptions.UnsupportedSignalException;
import org.apache.yetus.audience.InterfaceAudience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one external OS process: starts it, signals it and reaps it. A controller can be started
 * again once its previous process has exited.
 */
@InterfaceAudience.Private
public class ProcessController {
  private static final Logger LOG = LoggerFactory.getLogger(ProcessController.class);

  private final String name;
  private Process process;

  /**
   * @param name used in log and exception messages, e.g. "master-0"
   */
  public ProcessController(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Launches the process.
   * @param command executable followed by its arguments
   * @param env the complete environment of the child; nothing is inherited from this JVM
   * @param logFile stdout and stderr of the child are appended here
   * @return the pid of the new process
   * @throws IllegalNodeStateException if a previously started process is still alive
   * @throws LaunchFailureException if the executable could not be run
   */
  public synchronized long start(List<String> command, Map<String, String> env, File logFile)
      throws IOException {
    if (process != null && process.isAlive()) {
      throw new IllegalNodeStateException(name + " is already running as pid " + process.pid());
    }
    ProcessBuilder builder = new ProcessBuilder(command);
    builder.environment().clear();
    builder.environment().putAll(env);
    builder.redirectErrorStream(true);
    builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));
    LOG.info("Starting {}: {}", name, StringUtils.join(command, " "));
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new LaunchFailureException("Failed to launch " + name + " from " + command.get(0), e);
    }
    // Nothing is ever written to the child's stdin.
    process.getOutputStream().close();
    LOG.info("Started {} with pid {}, output in {}", name, process.pid(), logFile);
    return process.pid();
  }

  private synchronized Process getLiveProcess(Object action) throws IllegalNodeStateException {
    if (process == null) {
      throw new IllegalNodeStateException("Cannot " + action + " " + name
          + ": it was never started");
    }
    if (!process.isAlive()) {
      throw new IllegalNodeStateException("Cannot " + action + " " + name + ": pid "
          + process.pid() + " already exited with status " + process.exitValue());
    }
    return process;
  }

  /**
   * Sends {@code signal} to the process.
   * @throws IllegalNodeStateException if the process was never started or already exited
   * @throws UnsupportedSignalException if the platform cannot deliver the signal
   */
  public void signal(Signal signal) throws IOException {
    Process p = getLiveProcess("send " + signal + " to");
    LOG.debug("Sending {} to {} (pid {})", signal, name, p.pid());
    switch (signal) {
      case TERM:
        p.destroy();
        break;
      case KILL:
        p.destroyForcibly();
        break;
      default:
        sendWithKillCommand(p, signal);
    }
  }

  private void sendWithKillCommand(Process p, Signal signal) throws IOException {
    if (Shell.WINDOWS) {
      throw new UnsupportedSignalException(signal + " cannot be delivered to " + name
          + " on this platform");
    }
    String cmd = String.format("kill -s %s %d", signal.getName(), p.pid());
    Shell.ShellCommandExecutor shell =
        new Shell.ShellCommandExecutor(new String[] { "bash", "-c", cmd });
    try {
      shell.execute();
    } catch (Shell.ExitCodeException e) {
      if (!p.isAlive()) {
        throw new IllegalNodeStateException(name + " exited before " + signal
            + " could be delivered");
      }
      throw new IOException("Failed to send " + signal + " to " + name + ", exit code "
          + e.getExitCode() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Sends {@code signal} and waits for the process to exit. If it is still alive after
   * {@code timeoutMs} it gets SIGKILL; that is reported as {@link StopResult#FORCED_KILL} since the
   * process is gone all the same.
   */
  public StopResult killAndWait(Signal signal, long timeoutMs) throws IOException {
    Process p = getLiveProcess("stop");
    signal(signal);
    try {
      if (p.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
        LOG.info("{} (pid {}) exited with status {} after {}", name, p.pid(), p.exitValue(),
          signal);
        return StopResult.EXITED;
      }
      LOG.warn("{} (pid {}) did not exit within {} ms of {}; sending {}", name, p.pid(),
        timeoutMs, signal, Signal.KILL);
      p.destroyForcibly();
      p.waitFor();
      return StopResult.FORCED_KILL;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw (InterruptedIOException) new InterruptedIOException(
          "Interrupted waiting for " + name + " to exit").initCause(e);
    }
  }

  /**
   * Blocks until the process exits.
   * @return its exit status
   */
  public int waitForExit() throws IOException {
    Process p;
    synchronized (this) {
      if (process == null) {
        throw new IllegalNodeStateException(name + " was never started");
      }
      p = process;
    }
    try {
      return p.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw (InterruptedIOException) new InterruptedIOException(
          "Interrupted waiting for " + name + " to exit").initCause(e);
    }
  }

  public synchronized boolean isAlive() {
    return process != null && process.isAlive();
  }

  /**
   * @return pid of the last started process, -1 if never started
   */
  public synchronized long getPid() {
    return process == null ? -1 : process.pid();
  }

  /**
   * @return exit status of the last started process, or null if it never started or is alive
   */
  public synchronized Integer getExitStatus() {
    if (process == null || process.isAlive()) {
      return null;
    }
    return process.exitValue();
  }

  @Override
  public String toString() {
    return "ProcessController(" + name + ", pid=" + getPid() + ", alive=" + isAlive() + ")";
  }
}
