package io.fullerstack.strands.cell;

/**
 * Thrown when an {@link OwnershipCell} is borrowed from, or transferred again,
 * after its value has already been moved out.
 */
public class UseAfterTransferException extends IllegalStateException {

  private final String owner;

  /**
   * @param owner the owner that received the value when it was transferred out
   */
  public UseAfterTransferException ( String owner ) {
    super ( "Value was already transferred to '" + owner + "'; the cell is empty" );
    this.owner = owner;
  }

  /**
   * @return the owner holding the value since the transfer
   */
  public String owner () {
    return owner;
  }
}
