/*
 * Copyright (c) 2026 The sqlsketch-pool Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.sqlsketch.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WaitQueueTest {

	static Waiter waiter(long sequence) {
		return new Waiter(sequence, Thread.currentThread(), System.nanoTime());
	}

	@Test
	void pollsInSequenceOrder() {
		WaitQueue queue = new WaitQueue();
		Waiter w3 = waiter(3);
		Waiter w1 = waiter(1);
		Waiter w2 = waiter(2);
		queue.offer(w3);
		queue.offer(w1);
		queue.offer(w2);

		assertThat(queue.pollLive()).isSameAs(w1);
		assertThat(queue.pollLive()).isSameAs(w2);
		assertThat(queue.pollLive()).isSameAs(w3);
		assertThat(queue.pollLive()).isNull();
		assertThat(w1.state).isEqualTo(Waiter.STATE_NOTIFIED);
	}

	@ParameterizedTest
	@ValueSource(ints = {10, 100, 1000})
	void cancelDoesntTouchTheHeap(int depth) {
		WaitQueue queue = new WaitQueue();
		List<Waiter> waiters = new ArrayList<>();
		for (int i = 0; i < depth; i++) {
			Waiter w = waiter(i);
			waiters.add(w);
			queue.offer(w);
		}

		for (int i = 0; i < depth - 1; i++) {
			assertThat(queue.cancel(waiters.get(i))).as("cancel #" + i).isTrue();
		}

		assertThat(queue.size()).as("physical size").isEqualTo(depth);
		assertThat(queue.liveSize()).as("live size").isEqualTo(1);
		assertThat(queue.pollLive()).isSameAs(waiters.get(depth - 1));
		assertThat(queue.size()).as("cancelled entries dropped on the way").isZero();
	}

	@Test
	void cancelledEntriesSkippedWithoutNotification() {
		WaitQueue queue = new WaitQueue();
		Waiter w1 = waiter(1);
		Waiter w2 = waiter(2);
		Waiter w3 = waiter(3);
		queue.offer(w1);
		queue.offer(w2);
		queue.offer(w3);

		queue.cancel(w1);
		queue.cancel(w2);

		assertThat(queue.pollLive()).isSameAs(w3);
		assertThat(w1.state).isEqualTo(Waiter.STATE_CANCELLED);
		assertThat(w2.state).isEqualTo(Waiter.STATE_CANCELLED);
		assertThat(queue.size()).isZero();
		assertThat(queue.liveSize()).isZero();
	}

	@Test
	void cancelLosesAgainstNotification() {
		WaitQueue queue = new WaitQueue();
		Waiter w = waiter(1);
		queue.offer(w);

		assertThat(queue.pollLive()).isSameAs(w);
		assertThat(queue.cancel(w)).isFalse();
		assertThat(w.state).isEqualTo(Waiter.STATE_NOTIFIED);
		assertThat(queue.liveSize()).isZero();
	}

	@Test
	void compactsOnceMostlyCancelled() {
		WaitQueue queue = new WaitQueue();
		List<Waiter> waiters = new ArrayList<>();
		for (int i = 0; i < WaitQueue.COMPACTION_THRESHOLD; i++) {
			Waiter w = waiter(i);
			waiters.add(w);
			queue.offer(w);
		}
		for (int i = 0; i < WaitQueue.COMPACTION_THRESHOLD / 2 + 1; i++) {
			queue.cancel(waiters.get(i));
		}
		assertThat(queue.size()).isEqualTo(WaitQueue.COMPACTION_THRESHOLD);

		queue.offer(waiter(1000));

		int expectedLive = WaitQueue.COMPACTION_THRESHOLD - (WaitQueue.COMPACTION_THRESHOLD / 2 + 1) + 1;
		assertThat(queue.size()).isEqualTo(expectedLive);
		assertThat(queue.liveSize()).isEqualTo(expectedLive);
	}

	@Test
	void noCompactionBelowThreshold() {
		WaitQueue queue = new WaitQueue();
		List<Waiter> waiters = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			Waiter w = waiter(i);
			waiters.add(w);
			queue.offer(w);
		}
		for (Waiter w : waiters) {
			queue.cancel(w);
		}

		queue.offer(waiter(10));

		assertThat(queue.size()).isEqualTo(11);
		assertThat(queue.liveSize()).isEqualTo(1);
	}

	@Test
	void drainClosedNotifiesLiveWaitersOnly() {
		WaitQueue queue = new WaitQueue();
		Waiter w1 = waiter(1);
		Waiter w2 = waiter(2);
		Waiter w3 = waiter(3);
		queue.offer(w1);
		queue.offer(w2);
		queue.offer(w3);
		queue.cancel(w2);

		assertThat(queue.drainClosed()).isEqualTo(2);
		assertThat(w1.state).isEqualTo(Waiter.STATE_CLOSED);
		assertThat(w2.state).isEqualTo(Waiter.STATE_CANCELLED);
		assertThat(w3.state).isEqualTo(Waiter.STATE_CLOSED);
		assertThat(queue.size()).isZero();
		assertThat(queue.liveSize()).isZero();
	}

	@Test
	void parkReturnsOnDeadline() {
		Waiter w = waiter(1);
		long start = System.nanoTime();

		boolean interrupted = w.park(start + Duration.ofMillis(50).toNanos());

		assertThat(interrupted).isFalse();
		assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(Duration.ofMillis(50).toNanos());
		assertThat(w.state).isEqualTo(Waiter.STATE_WAITING);
	}

	@Test
	void parkReturnsOnNotification() throws InterruptedException {
		CountDownLatch registered = new CountDownLatch(1);
		AtomicBoolean woken = new AtomicBoolean();
		Waiter[] holder = new Waiter[1];
		Thread t = new Thread(() -> {
			holder[0] = new Waiter(1, Thread.currentThread(), System.nanoTime());
			registered.countDown();
			holder[0].park(Long.MAX_VALUE);
			woken.set(true);
		});
		t.start();
		registered.await();

		assertThat(holder[0].notifyAvailable()).isTrue();
		await().atMost(Duration.ofSeconds(2)).untilTrue(woken);
		assertThat(holder[0].notifyAvailable()).as("single use").isFalse();
		t.join();
	}

	@Test
	void parkSurvivesInterruptAndReportsIt() throws InterruptedException {
		CountDownLatch registered = new CountDownLatch(1);
		AtomicBoolean reported = new AtomicBoolean();
		Waiter[] holder = new Waiter[1];
		Thread t = new Thread(() -> {
			holder[0] = new Waiter(1, Thread.currentThread(), System.nanoTime());
			registered.countDown();
			reported.set(holder[0].park(Long.MAX_VALUE));
		});
		t.start();
		registered.await();

		t.interrupt();
		Thread.sleep(50);
		assertThat(t.isAlive()).as("still parked after interrupt").isTrue();

		holder[0].notifyClosed();
		t.join(2000);
		assertThat(t.isAlive()).isFalse();
		assertThat(reported).isTrue();
		assertThat(holder[0].state).isEqualTo(Waiter.STATE_CLOSED);
	}
}
