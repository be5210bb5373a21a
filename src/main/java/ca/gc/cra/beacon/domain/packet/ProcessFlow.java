package ca.gc.cra.beacon.domain.packet;

import java.util.Objects;

/**
 * Method, thread, or process boundary rendered in the console's process flow view.
 *
 * @param header shared header
 * @param flowType boundary kind
 * @param title method, thread, or process name
 * @param hostName emitting host
 * @param processId emitting process id
 * @param threadId emitting thread id
 * @since 0.1.0
 */
public record ProcessFlow(
    PacketHeader header,
    ProcessFlowType flowType,
    String title,
    String hostName,
    int processId,
    int threadId) implements Packet {

  public ProcessFlow {
    Objects.requireNonNull(header, "header");
    Objects.requireNonNull(flowType, "flowType");
  }

  @Override
  public PacketKind kind() {
    return PacketKind.PROCESS_FLOW;
  }
}
