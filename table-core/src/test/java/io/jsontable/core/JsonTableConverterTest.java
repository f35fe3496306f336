package io.jsontable.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.jsontable.core.DiagnosticsSink.Level;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class JsonTableConverterTest {

  @Mock private DiagnosticsSink sink;

  private JsonTableConverter converter;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    converter = new JsonTableConverter(ConversionConfig.defaults(), sink);
  }

  private static Map<String, Object> object(Object... keyValues) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put((String) keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  private JsonTableConverter cappedAt(int cap) {
    return new JsonTableConverter(ConversionConfig.defaults().withDefaultCap(cap), sink);
  }

  private static List<Object> numbered(int count) {
    List<Object> data = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      data.add(object("id", i));
    }
    return data;
  }

  // ==================== Shapes ====================

  @Test
  void heterogeneousObjectsShareOneHeader() {
    List<Object> data = List.of(object("a", 1, "b", 2), object("b", 3, "c", 4));

    TableMatrix table = converter.convert(data, true, null);

    assertEquals(
        List.of(List.of("a", "b", "c"), List.of("1", "2", ""), List.of("", "3", "4")),
        table.rows());
    assertTrue(table.hasHeader());
    verifyNoInteractions(sink);
  }

  @Test
  void singleObjectBecomesOneRow() {
    TableMatrix table = converter.convert(object("x", "y"), true, null);

    assertEquals(List.of(List.of("x"), List.of("y")), table.rows());
  }

  @Test
  void singleObjectWithoutHeader() {
    TableMatrix table = converter.convert(object("x", "y", "z", 5), false, null);

    assertEquals(List.of(List.of("y", "5")), table.rows());
    assertFalse(table.hasHeader());
  }

  @Test
  void scalarArrayUsesValueHeader() {
    TableMatrix table = converter.convert(List.of("p", "q", "r"), true, null);

    assertEquals(
        List.of(List.of("Value"), List.of("p"), List.of("q"), List.of("r")), table.rows());
  }

  @Test
  void scalarArrayWithoutHeader() {
    TableMatrix table = converter.convert(List.of(1, true, 2.5), false, null);

    assertEquals(List.of(List.of("1"), List.of("true"), List.of("2.5")), table.rows());
  }

  @Test
  void arrayOfArraysKeepsRowWidths() {
    List<Object> data = List.of(List.of("Name", "Age"), List.of("Alice", 25), List.of("Bob"));

    TableMatrix table = converter.convert(data, false, null);

    assertEquals(
        List.of(List.of("Name", "Age"), List.of("Alice", "25"), List.of("Bob")), table.rows());
  }

  @Test
  void arrayOfArraysUsesFirstInnerArrayAsHeader() {
    List<Object> data = List.of(List.of("Name", "Age"), List.of("Alice", 25));

    TableMatrix table = converter.convert(data, true, null);

    assertTrue(table.hasHeader());
    assertEquals(List.of("Name", "Age"), table.header());
    assertEquals(1, table.dataRowCount());
    assertEquals(List.of(List.of("Alice", "25")), table.dataRows());
  }

  @Test
  void arrayOfArraysWithoutHeaderKeepsEveryRowAsData() {
    TableMatrix table = converter.convert(List.of(List.of("a", "b"), List.of(1, 2)), false, null);

    assertFalse(table.hasHeader());
    assertEquals(2, table.dataRowCount());
  }

  @Test
  void nullsRenderAsEmptyCellsEverywhere() {
    List<Object> data = new ArrayList<>();
    data.add(object("a", null, "b", "x"));
    TableMatrix objects = converter.convert(data, false, null);
    assertEquals(List.of(List.of("", "x")), objects.rows());

    TableMatrix raw = converter.convert(List.of(Arrays.asList("x", null)), false, null);
    assertEquals(List.of(List.of("x", "")), raw.rows());

    TableMatrix scalars = converter.convert(Arrays.asList("x", null), false, null);
    assertEquals(List.of(List.of("x"), List.of("")), scalars.rows());

    for (List<String> row : objects.rows()) {
      assertFalse(row.contains("null"));
    }
  }

  @Test
  void mixedObjectArrayKeepsStrayElementInFirstColumn() {
    List<Object> data = List.of(object("a", 1, "b", 2), "stray", 42);

    TableMatrix table = converter.convert(data, true, null);

    assertEquals(
        List.of(
            List.of("a", "b"), List.of("1", "2"), List.of("stray", ""), List.of("42", "")),
        table.rows());
  }

  @Test
  void nestedValuesRenderAsJson() {
    Map<String, Object> data = object("tags", List.of("x", "y"), "meta", object("k", 1));

    TableMatrix table = converter.convert(data, false, null);

    assertEquals(List.of(List.of("[\"x\",\"y\"]", "{\"k\":1}")), table.rows());
  }

  // ==================== Failures ====================

  @Test
  void emptyInputsFailAsEmptyData() {
    assertThrows(EmptyDataException.class, () -> converter.convert(null, true, null));
    assertThrows(EmptyDataException.class, () -> converter.convert(List.of(), true, null));
    assertThrows(EmptyDataException.class, () -> converter.convert(Map.of(), true, null));
    verifyNoInteractions(sink);
  }

  @Test
  void scalarRootFailsAsInvalidShape() {
    InvalidShapeException e =
        assertThrows(
            InvalidShapeException.class, () -> converter.convert("just a string", true, null));
    assertTrue(e.getMessage().contains("array or object"));
    assertThrows(InvalidShapeException.class, () -> converter.convert(42, true, null));
    assertThrows(InvalidShapeException.class, () -> converter.convert(Boolean.TRUE, false, 0));
    verifyNoInteractions(sink);
  }

  @Test
  void nullFirstElementFailsAsInvalidShape() {
    List<Object> data = Arrays.asList(null, object("a", 1));

    assertThrows(InvalidShapeException.class, () -> converter.convert(data, true, null));
  }

  @Test
  void negativeLimitIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> converter.convert(List.of("a"), true, -1));
  }

  @Test
  void failuresShareBaseType() {
    JsonTableException e =
        assertThrows(JsonTableException.class, () -> converter.convert(List.of(), false, null));
    assertInstanceOf(EmptyDataException.class, e);
  }

  // ==================== Row limits ====================

  @Test
  void dataAtTheCapIsNotTruncated() {
    JsonTableConverter small = cappedAt(5);

    TableMatrix table = small.convert(numbered(5), true, null);

    assertEquals(5, table.dataRowCount());
    verifyNoInteractions(sink);
  }

  @Test
  void dataAboveTheCapIsTruncatedWithOneWarning() {
    JsonTableConverter small = cappedAt(5);

    TableMatrix table = small.convert(numbered(8), true, null);

    assertEquals(5, table.dataRowCount());
    assertEquals(List.of("4"), table.dataRows().get(4));
    ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
    verify(sink, times(1)).emit(eq(Level.WARNING), message.capture());
    verifyNoMoreInteractions(sink);
    assertTrue(message.getValue().contains("8 rows"));
    assertTrue(message.getValue().contains("first 5 rows"));
    assertTrue(message.getValue().contains("limit 0"));
  }

  @Test
  void limitZeroKeepsEveryRowWithOneInfo() {
    JsonTableConverter small = cappedAt(5);

    TableMatrix table = small.convert(numbered(8), false, 0);

    assertEquals(8, table.dataRowCount());
    verify(sink, times(1)).emit(eq(Level.INFO), anyString());
    verifyNoMoreInteractions(sink);
  }

  @Test
  void explicitLimitIsUsedVerbatim() {
    JsonTableConverter small = cappedAt(5);

    assertEquals(7, small.convert(numbered(8), false, 7).dataRowCount());
    assertEquals(8, small.convert(numbered(8), false, 100).dataRowCount());
    assertEquals(2, small.convert(numbered(8), false, 2).dataRowCount());
    verifyNoInteractions(sink);
  }

  @Test
  void explicitLimitAppliesToSingleObject() {
    TableMatrix table = converter.convert(object("a", 1), true, 3);

    assertEquals(List.of(List.of("a"), List.of("1")), table.rows());
  }

  @Test
  void headerOnlyReflectsRowsWithinLimit() {
    List<Object> data = List.of(object("a", 1), object("b", 2));

    TableMatrix table = converter.convert(data, true, 1);

    assertEquals(List.of(List.of("a"), List.of("1")), table.rows());
  }

  @Test
  void perCallBoundsOverrideConstructorBounds() {
    ConversionConfig tight = new ConversionConfig(2, 10, 1, 3);

    List<Object> data =
        List.of(object("abcd", 0, "a", 1, "b", 2), object("a", 3), object("a", 4));

    TableMatrix table = converter.convert(data, true, null, tight);

    assertEquals(List.of(List.of("a"), List.of("1"), List.of("3")), table.rows());
    verify(sink).emit(eq(Level.WARNING), contains("3 rows"));
  }

  @Test
  void inputIsNotModified() {
    List<Object> data = new ArrayList<>(List.of(object("a", 1), object("b", 2)));
    List<Object> snapshot = new ArrayList<>(data);

    converter.convert(data, true, 1);

    assertEquals(snapshot, data);
  }

  @Test
  void everyCallReturnsAFreshMatrix() {
    List<Object> data = Collections.singletonList(object("a", 1));

    TableMatrix first = converter.convert(data, true, null);
    TableMatrix second = converter.convert(data, true, null);

    assertEquals(first, second);
    assertNotSame(first, second);
    assertThrows(UnsupportedOperationException.class, () -> first.rows().add(List.of()));
  }
}
