/*-
 * -\-\-
 * ECS Run Task CLI
 * --
 * Copyright (C) 2026 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.ecsrun.cli;

import static com.google.common.base.Throwables.getStackTraceAsString;

import com.amazonaws.services.ecs.AmazonECSClientBuilder;
import com.amazonaws.services.logs.AWSLogsClientBuilder;
import com.google.common.collect.ImmutableList;
import com.spotify.ecsrun.aws.EcsClient;
import com.spotify.ecsrun.aws.LogsClient;
import com.spotify.ecsrun.cli.CliExitException.ExitStatus;
import com.spotify.ecsrun.model.OverrideSpec;
import com.spotify.ecsrun.model.TaskDefinitionSpec;
import com.spotify.ecsrun.runner.ConfigurationException;
import com.spotify.ecsrun.runner.FinalizationException;
import com.spotify.ecsrun.runner.RunResult;
import com.spotify.ecsrun.runner.RunSpec;
import com.spotify.ecsrun.runner.RunnerConfig;
import com.spotify.ecsrun.runner.SubmissionException;
import com.spotify.ecsrun.runner.TaskPollingException;
import com.spotify.ecsrun.runner.TaskRunner;
import com.spotify.ecsrun.taskdef.TaskDefinitionParser;
import com.spotify.logging.LoggingConfigurator;
import com.spotify.logging.LoggingConfigurator.Level;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.Argument;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.helper.HelpScreenException;

public final class CliMain {

  private static final String ENV_REGION = "AWS_REGION";

  private static final String ECS_RUN_VERSION =
      "ecs-run " + CliMain.class.getPackage().getImplementationVersion();

  private static final long SHUTDOWN_GRACE_SECONDS = 10;

  private final EcsRunParser parser;
  private final Namespace namespace;
  private final CliOutput cliOutput;
  private final CliContext cliContext;
  private final boolean debug;

  private CliMain(
      EcsRunParser parser,
      Namespace namespace,
      CliOutput cliOutput,
      CliContext cliContext,
      boolean debug) {
    this.parser = Objects.requireNonNull(parser);
    this.namespace = Objects.requireNonNull(namespace);
    this.cliOutput = Objects.requireNonNull(cliOutput);
    this.cliContext = Objects.requireNonNull(cliContext);
    this.debug = debug;
  }

  public static void main(String... args) {
    try {
      run(CliContext.DEFAULT, args);
    } catch (CliExitException e) {
      System.exit(e.code());
    }
  }

  static void run(CliContext cliContext, String... args) {
    run(cliContext, ImmutableList.copyOf(args));
  }

  static void run(CliContext cliContext, Collection<String> args) {
    final EcsRunParser parser = new EcsRunParser(cliContext);
    final Namespace namespace;

    try {
      namespace = parser.parser.parseArgs(args.toArray(new String[0]));
    } catch (HelpScreenException e) {
      throw CliExitException.of(ExitStatus.Success);
    } catch (ArgumentParserException e) {
      parser.parser.handleError(e);
      throw CliExitException.of(ExitStatus.ArgumentError);
    }

    final boolean debug = Objects.equals(namespace.getBoolean(parser.debug.getDest()), true);
    final boolean quiet = Objects.equals(namespace.getBoolean(parser.quiet.getDest()), true);

    if (quiet) {
      LoggingConfigurator.configureNoLogging();
    } else if (debug) {
      LoggingConfigurator.configureDefaults("ecs-run", Level.DEBUG);
    } else {
      LoggingConfigurator.configureDefaults("ecs-run", Level.INFO);
    }

    new CliMain(parser, namespace, cliContext.output(), cliContext, debug).run();
  }

  private void run() {
    final Thread runThread = Thread.currentThread();
    final AtomicBoolean done = new AtomicBoolean();
    final CountDownLatch finished = new CountDownLatch(1);
    cliContext.addShutdownHook(new Thread(() -> {
      if (done.get()) {
        return;
      }
      runThread.interrupt();
      try {
        finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }, "ecs-run-shutdown"));

    try {
      final RunSpec spec = runSpec();
      final RunnerConfig runnerConfig = RunnerConfig.fromConfig(cliContext.config());
      final TaskRunner runner =
          cliContext.createRunner(spec.region(), runnerConfig, cliOutput::printLine);
      final RunResult result = runner.run(spec);
      if (!result.isSuccess()) {
        cliOutput.printMessage("Container " + result.failedContainer().orElse("")
                               + " exited with " + result.exitCode());
        throw CliExitException.container(result.exitCode());
      }
    } catch (ArgumentParserException e) {
      parser.parser.handleError(e);
      throw CliExitException.of(ExitStatus.ArgumentError);
    } catch (ConfigurationException e) {
      printError("Configuration error: ", e);
      throw CliExitException.of(ExitStatus.ConfigurationError);
    } catch (SubmissionException e) {
      printError("Submission error: ", e);
      throw CliExitException.of(ExitStatus.SubmissionError);
    } catch (TaskPollingException | FinalizationException e) {
      printError("Task error: ", e);
      throw CliExitException.of(ExitStatus.TaskError);
    } catch (InterruptedException e) {
      cliOutput.printError("Cancelled");
      throw CliExitException.of(ExitStatus.Cancelled);
    } catch (CliExitException e) {
      throw e;
    } catch (Exception e) {
      cliOutput.printError(getStackTraceAsString(e));
      throw CliExitException.of(ExitStatus.UnknownError);
    } finally {
      done.set(true);
      finished.countDown();
    }
  }

  private void printError(String prefix, Exception e) {
    if (debug) {
      cliOutput.printError(getStackTraceAsString(e));
    }
    cliOutput.printError(prefix + e.getMessage());
  }

  private RunSpec runSpec() throws ArgumentParserException, ConfigurationException {
    final String region = namespace.getString(parser.region.getDest());
    if (region == null) {
      throw new ArgumentParserException(
          "AWS region not set, use --region or the " + ENV_REGION + " environment variable",
          parser.parser);
    }

    final int count = namespace.getInt(parser.count.getDest());
    if (count < 1) {
      throw new ArgumentParserException("count must be at least 1", parser.parser);
    }

    final List<OverrideSpec> overrides = new ArrayList<>();
    final Optional<String> service = Optional.ofNullable(
        namespace.getString(parser.service.getDest()));
    final List<String> command = list(parser.command);
    if (!command.isEmpty()) {
      overrides.add(OverrideSpec.create(service, command, List.of()));
    } else if (service.isPresent()) {
      throw new ArgumentParserException(
          "a command is required when a service is given", parser.parser);
    }
    for (String override : list(parser.override)) {
      try {
        overrides.add(OverrideSpec.parse(override));
      } catch (IllegalArgumentException e) {
        throw new ArgumentParserException(e.getMessage(), e, parser.parser);
      }
    }

    final TaskDefinitionSpec taskDefinition = new TaskDefinitionParser(cliContext.env())
        .parse(Paths.get(namespace.getString(parser.file.getDest())));

    return RunSpec.builder()
        .name(Optional.ofNullable(namespace.getString(parser.name.getDest())))
        .taskDefinition(taskDefinition)
        .cluster(namespace.getString(parser.cluster.getDest()))
        .logGroup(namespace.getString(parser.logGroup.getDest()))
        .region(region)
        .fargate(Objects.equals(namespace.getBoolean(parser.fargate.getDest()), true))
        .subnets(list(parser.subnet))
        .securityGroups(list(parser.securityGroup))
        .count(count)
        .overrides(overrides)
        .environment(list(parser.env))
        .build();
  }

  private List<String> list(Argument argument) {
    final List<String> values = namespace.getList(argument.getDest());
    return values == null ? List.of() : ImmutableList.copyOf(values);
  }

  private static class EcsRunParser {

    final ArgumentParser parser;

    final Argument name;
    final Argument file;
    final Argument cluster;
    final Argument logGroup;
    final Argument region;
    final Argument fargate;
    final Argument subnet;
    final Argument securityGroup;
    final Argument count;
    final Argument service;
    final Argument command;
    final Argument override;
    final Argument env;
    final Argument debug;
    final Argument quiet;

    EcsRunParser(CliContext cliContext) {
      final Config config = cliContext.config();

      parser = ArgumentParsers.newArgumentParser("ecs-run")
          .description("Run a task definition on Amazon ECS and follow its output")
          .version(ECS_RUN_VERSION);
      parser.addArgument("--version").action(Arguments.version());

      name = parser.addArgument("-n", "--name")
          .help("name of the run, used as log stream prefix (default: generated)");
      file = parser.addArgument("-f", "--file")
          .setDefault(config.getString("ecs-run.cli.file"))
          .help("task definition file, JSON or YAML");
      cluster = parser.addArgument("-c", "--cluster")
          .setDefault(config.getString("ecs-run.cli.cluster"))
          .help("ECS cluster");
      logGroup = parser.addArgument("-l", "--log-group")
          .dest("log_group")
          .setDefault(config.getString("ecs-run.cli.log-group"))
          .help("CloudWatch Logs group");
      region = parser.addArgument("-r", "--region")
          .setDefault(cliContext.env().get(ENV_REGION))
          .help("AWS region (can also be set with environment variable " + ENV_REGION + ")");
      fargate = parser.addArgument("--fargate")
          .action(Arguments.storeTrue())
          .help("use the FARGATE launch type");
      subnet = parser.addArgument("--subnet")
          .action(Arguments.append())
          .help("awsvpc subnet, can be repeated");
      securityGroup = parser.addArgument("--security-group")
          .dest("security_group")
          .action(Arguments.append())
          .help("awsvpc security group, can be repeated");
      count = parser.addArgument("-C", "--count")
          .type(Integer.class)
          .setDefault(1)
          .help("number of tasks to run");
      service = parser.addArgument("-s", "--service")
          .help("container that the positional command applies to");
      override = parser.addArgument("-o", "--override")
          .action(Arguments.append())
          .metavar("SERVICE:COMMAND")
          .help("override the command of a container, can be repeated");
      env = parser.addArgument("-e", "--env")
          .action(Arguments.append())
          .metavar("KEY[=VALUE]")
          .help("environment variable for overridden containers, taken from the local "
                + "environment when no value is given, can be repeated");
      debug = parser.addArgument("--debug")
          .action(Arguments.storeTrue())
          .help("debug output");
      quiet = parser.addArgument("-q", "--quiet")
          .action(Arguments.storeTrue())
          .help("only print container output");
      command = parser.addArgument("command")
          .nargs("*")
          .help("command to run instead of the default command of the container");
    }
  }

  interface CliContext {

    CliOutput output();

    Map<String, String> env();

    Config config();

    TaskRunner createRunner(String region, RunnerConfig config, Consumer<String> output);

    void addShutdownHook(Thread hook);

    CliContext DEFAULT = new CliContext() {
      @Override
      public CliOutput output() {
        return new PlainCliOutput();
      }

      @Override
      public Map<String, String> env() {
        return System.getenv();
      }

      @Override
      public Config config() {
        return ConfigFactory.load();
      }

      @Override
      public TaskRunner createRunner(String region, RunnerConfig config,
                                     Consumer<String> output) {
        final EcsClient ecs = EcsClient.of(
            AmazonECSClientBuilder.standard().withRegion(region).build());
        final LogsClient logs = LogsClient.of(
            AWSLogsClientBuilder.standard().withRegion(region).build());
        return TaskRunner.ecs(ecs, logs, config, env(), output);
      }

      @Override
      public void addShutdownHook(Thread hook) {
        Runtime.getRuntime().addShutdownHook(hook);
      }
    };
  }
}
