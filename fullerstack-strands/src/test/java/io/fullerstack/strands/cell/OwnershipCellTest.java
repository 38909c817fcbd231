package io.fullerstack.strands.cell;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OwnershipCellTest {

  @Test
  @DisplayName ( "Borrow, increment, transfer to B, then every access fails" )
  void transferScenario () {
    OwnershipCell < Integer > cell = OwnershipCell.of ( 0, "A" );

    int incremented = cell.borrowExclusive ( access -> {
      access.set ( access.get () + 1 );
      return access.get ();
    } );

    assertThat ( incremented ).isEqualTo ( 1 );
    assertThat ( cell.currentOwner () ).isEqualTo ( "A" );

    Integer moved = cell.transfer ( "B" );

    assertThat ( moved ).isEqualTo ( 1 );
    assertThat ( cell.currentOwner () ).isEqualTo ( "B" );
    assertThat ( cell.isAvailable () ).isFalse ();
    assertThatThrownBy ( () -> cell.borrowShared ( v -> v ) )
      .isInstanceOf ( UseAfterTransferException.class )
      .hasMessageContaining ( "'B'" );
  }

  @Nested
  @DisplayName ( "After transfer" )
  class AfterTransfer {

    @Test
    void exclusiveBorrowFails () {
      OwnershipCell < List < String > > cell = new OwnershipCell <> ( new ArrayList <> () );
      cell.transfer ( "worker" );

      assertThatThrownBy ( () -> cell.borrowExclusive ( access -> access.get ().add ( "x" ) ) )
        .isInstanceOf ( UseAfterTransferException.class );
    }

    @Test
    void secondTransferFailsAndKeepsOwner () {
      OwnershipCell < String > cell = OwnershipCell.of ( "payload", "A" );
      cell.transfer ( "B" );

      assertThatThrownBy ( () -> cell.transfer ( "C" ) )
        .isInstanceOfSatisfying ( UseAfterTransferException.class,
          e -> assertThat ( e.owner () ).isEqualTo ( "B" ) );
      assertThat ( cell.currentOwner () ).isEqualTo ( "B" );
    }

    @Test
    void failedBorrowDoesNotRunCallback () {
      OwnershipCell < String > cell = new OwnershipCell <> ( "payload" );
      cell.transfer ( "B" );
      AtomicReference < String > seen = new AtomicReference <> ();

      assertThatThrownBy ( () -> cell.borrowShared ( v -> {
        seen.set ( v );
        return v;
      } ) ).isInstanceOf ( UseAfterTransferException.class );
      assertThat ( seen.get () ).isNull ();
    }
  }

  @Test
  void defaultOwnerIsAnonymous () {
    OwnershipCell < String > cell = new OwnershipCell <> ( "value" );

    assertThat ( cell.currentOwner () ).isEqualTo ( "anonymous" );
    assertThat ( cell.isAvailable () ).isTrue ();
    assertThat ( cell ).hasToString ( "OwnershipCell[owner=anonymous, available=true]" );
  }

  @Test
  void rejectsNullValue () {
    assertThatThrownBy ( () -> new OwnershipCell <> ( null, "A" ) )
      .isInstanceOf ( NullPointerException.class );
  }

  @Test
  void accessCannotEscapeTheBorrow () {
    OwnershipCell < String > cell = OwnershipCell.of ( "v1", "A" );
    AtomicReference < OwnershipCell.Access < String > > leaked = new AtomicReference <> ();

    cell.borrowExclusive ( access -> {
      leaked.set ( access );
      return null;
    } );

    assertThatThrownBy ( () -> leaked.get ().set ( "v2" ) ).isInstanceOf ( IllegalStateException.class );
    String value = cell.borrowShared ( v -> v );
    assertThat ( value ).isEqualTo ( "v1" );
  }

  @Test
  void sharedBorrowSeesMutationsInPlace () {
    OwnershipCell < List < String > > cell = OwnershipCell.of ( new ArrayList <> (), "A" );

    cell.borrowExclusive ( access -> access.get ().add ( "first" ) );
    cell.borrowExclusive ( access -> access.get ().add ( "second" ) );

    int size = cell.borrowShared ( List::size );
    assertThat ( size ).isEqualTo ( 2 );
    assertThat ( cell.transfer ( "B" ) ).containsExactly ( "first", "second" );
  }

  @Test
  void concurrentExclusiveBorrowsAreSerialized () throws Exception {
    OwnershipCell < Integer > cell = OwnershipCell.of ( 0, "counter" );
    int threadCount = 8;
    int incrementsPerThread = 1000;
    CountDownLatch start = new CountDownLatch ( 1 );
    CountDownLatch done = new CountDownLatch ( threadCount );

    for ( int t = 0; t < threadCount; t++ ) {
      new Thread ( () -> {
        try {
          start.await ();
          for ( int i = 0; i < incrementsPerThread; i++ ) {
            cell.borrowExclusive ( access -> {
              access.set ( access.get () + 1 );
              return null;
            } );
          }
        } catch ( InterruptedException e ) {
          Thread.currentThread ().interrupt ();
        } finally {
          done.countDown ();
        }
      } ).start ();
    }

    start.countDown ();
    assertThat ( done.await ( 10, TimeUnit.SECONDS ) ).isTrue ();
    assertThat ( cell.transfer ( "reader" ) ).isEqualTo ( threadCount * incrementsPerThread );
  }

  @Test
  void onlyOneConcurrentTransferWins () throws Exception {
    OwnershipCell < String > cell = OwnershipCell.of ( "prize", "origin" );
    int threadCount = 10;
    CountDownLatch start = new CountDownLatch ( 1 );
    CountDownLatch done = new CountDownLatch ( threadCount );
    List < String > winners = java.util.Collections.synchronizedList ( new ArrayList <> () );

    for ( int t = 0; t < threadCount; t++ ) {
      String contender = "contender-" + t;
      new Thread ( () -> {
        try {
          start.await ();
          cell.transfer ( contender );
          winners.add ( contender );
        } catch ( UseAfterTransferException expected ) {
          // lost the race
        } catch ( InterruptedException e ) {
          Thread.currentThread ().interrupt ();
        } finally {
          done.countDown ();
        }
      } ).start ();
    }

    start.countDown ();
    assertThat ( done.await ( 5, TimeUnit.SECONDS ) ).isTrue ();
    assertThat ( winners ).hasSize ( 1 );
    assertThat ( cell.currentOwner () ).isEqualTo ( winners.get ( 0 ) );
  }
}
