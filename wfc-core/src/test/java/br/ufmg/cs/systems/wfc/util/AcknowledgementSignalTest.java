package br.ufmg.cs.systems.wfc.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AcknowledgementSignalTest {

   @Test
   @Timeout(value = 10, unit = TimeUnit.SECONDS)
   void waiterResumesOnAcknowledgement() throws Exception {
      AcknowledgementSignal signal = new AcknowledgementSignal();
      CountDownLatch done = new CountDownLatch(1);
      AtomicBoolean result = new AtomicBoolean(false);

      Thread waiter = new Thread(() -> {
         result.set(signal.awaitAcknowledgement());
         done.countDown();
      });
      waiter.start();

      assertFalse(done.await(200, TimeUnit.MILLISECONDS));
      signal.acknowledge();
      assertTrue(done.await(5, TimeUnit.SECONDS));
      assertTrue(result.get());
      assertFalse(signal.isPending());
   }

   @Test
   void acknowledgementIsConsumedOnce() {
      AcknowledgementSignal signal = new AcknowledgementSignal();
      signal.acknowledge();
      signal.acknowledge();

      assertTrue(signal.isPending());
      assertTrue(signal.awaitAcknowledgement());
      assertFalse(signal.isPending());
   }

   @Test
   @Timeout(value = 10, unit = TimeUnit.SECONDS)
   void interruptedWaiterGivesUp() throws Exception {
      AcknowledgementSignal signal = new AcknowledgementSignal();
      AtomicBoolean result = new AtomicBoolean(true);
      AtomicBoolean interrupted = new AtomicBoolean(false);

      Thread waiter = new Thread(() -> {
         result.set(signal.awaitAcknowledgement());
         interrupted.set(Thread.currentThread().isInterrupted());
      });
      waiter.start();
      Thread.sleep(100);
      waiter.interrupt();
      waiter.join();

      assertFalse(result.get());
      assertTrue(interrupted.get());
   }
}
