package ca.gc.cra.beacon.domain.packet;

/**
 * Console classification of a {@link LogEntry}; decides icon and grouping in the viewer.
 *
 * @since 0.1.0
 */
public enum LogEntryType {
  SEPARATOR(0),
  ENTER_METHOD(1),
  LEAVE_METHOD(2),
  RESET_CALLSTACK(3),
  MESSAGE(100),
  WARNING(101),
  ERROR(102),
  INTERNAL_ERROR(103),
  COMMENT(104),
  VARIABLE_VALUE(105),
  CHECKPOINT(106),
  DEBUG(107),
  VERBOSE(108),
  FATAL(109),
  CONDITIONAL(110),
  ASSERT(111),
  TEXT(200),
  BINARY(201),
  GRAPHIC(202),
  SOURCE(203),
  OBJECT(204),
  WEB_CONTENT(205),
  SYSTEM(206),
  MEMORY_STATISTIC(207),
  DATABASE_RESULT(208),
  DATABASE_STRUCTURE(209);

  private final int wireValue;

  LogEntryType(int wireValue) {
    this.wireValue = wireValue;
  }

  public int wireValue() {
    return wireValue;
  }

  /**
   * Returns the entry type conventionally used for plain messages at {@code level}.
   *
   * @param level caller level
   * @return matching entry type
   */
  public static LogEntryType forLevel(Level level) {
    return switch (level) {
      case DEBUG -> DEBUG;
      case VERBOSE -> VERBOSE;
      case MESSAGE, CONTROL -> MESSAGE;
      case WARNING -> WARNING;
      case ERROR -> ERROR;
      case FATAL -> FATAL;
    };
  }

  public static LogEntryType fromWire(int wireValue) {
    for (LogEntryType type : values()) {
      if (type.wireValue == wireValue) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown log entry type " + wireValue);
  }
}
