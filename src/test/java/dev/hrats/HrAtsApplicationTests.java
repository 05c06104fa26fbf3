package dev.hrats;

import dev.hrats.exception.HrAtsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HrAtsApplicationTests {

  @Mock
  private CommandRunner commandRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldRunCommandAndExitWithItsStatus() {
    HrAtsApplication app = new HrAtsApplication(commandRunner, exitManager);

    when(commandRunner.execute("list")).thenReturn(CommandRunner.EXIT_OK);

    app.run("list");

    verify(commandRunner).execute("list");
    verify(exitManager).exit(0);
  }

  @Test
  void shouldPassUsageStatusThrough() {
    HrAtsApplication app = new HrAtsApplication(commandRunner, exitManager);

    when(commandRunner.execute()).thenReturn(CommandRunner.EXIT_USAGE);

    app.run();

    verify(exitManager).exit(2);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    HrAtsApplication app = new HrAtsApplication(commandRunner, exitManager);

    when(commandRunner.execute("dashboard")).thenThrow(new HrAtsException("database is locked"));

    app.run("dashboard");

    verify(exitManager).exit(1);
  }
}
