/* 
 * Copyright (C) 2026 by LA7ECA, Øyvind Hanssen (ohanssen@acm.org)
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 */
 
package no.polaric.aprsis.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;


class RateCounterTest {

  @Test
  void countsWithinWindow() {
    AtomicLong clock = new AtomicLong(100_000);
    RateCounter r = new RateCounter(10, clock::get);
    for (int i = 0; i < 5; i++) {
      r.inc();
      clock.addAndGet(1000);
    }
    assertEquals(5, r.count());
    assertEquals(0.5, r.rate(), 1e-9);
  }

  @Test
  void oldEventsFallOut() {
    AtomicLong clock = new AtomicLong(100_000);
    RateCounter r = new RateCounter(10, clock::get);
    r.add(3);
    clock.addAndGet(5000);
    r.add(2);
    clock.addAndGet(5000);
    assertEquals(2, r.count());
    clock.addAndGet(60_000);
    assertEquals(0, r.count());
  }
}
