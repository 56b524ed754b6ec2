package checkedc.analysis;

import static org.junit.Assert.*;

import java.util.NoSuchElementException;

import org.junit.Test;

public class QueueSetTest {

  @Test
  public void testFirstInFirstOut() {
    QueueSet<String> queue = new QueueSet<String>();
    assertTrue(queue.add("B3"));
    assertTrue(queue.add("B2"));
    assertTrue(queue.add("B1"));
    assertEquals("B3", queue.remove());
    assertEquals("B2", queue.remove());
    assertEquals("B1", queue.remove());
    assertTrue(queue.isEmpty());
  }

  @Test
  public void testDuplicatesAreIgnored() {
    QueueSet<Integer> queue = new QueueSet<Integer>();
    assertTrue(queue.add(1));
    assertTrue(queue.add(2));
    assertFalse(queue.add(1));
    assertEquals(2, queue.size());
    assertTrue(queue.contains(1));
    assertEquals(Integer.valueOf(1), queue.remove());
    assertFalse(queue.contains(1));
    // Removed elements may be queued again, behind the others.
    assertTrue(queue.add(1));
    assertEquals(Integer.valueOf(2), queue.remove());
    assertEquals(Integer.valueOf(1), queue.remove());
  }

  @Test(expected = NoSuchElementException.class)
  public void testRemoveFromEmpty() {
    new QueueSet<Object>().remove();
  }
}
