/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.iomaps.tiles.stac;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.DelegatingSeekableInputStream;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.ParquetDecodingException;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.io.SeekableInputStream;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;
import org.iomaps.common.error.MapsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes a whole GeoParquet file held in memory.
 */
public class GeoParquetReader implements RowReader {
  private static final Logger LOG = LoggerFactory.getLogger(GeoParquetReader.class);

  @Override
  public List<Map<String, Object>> read(String locator, byte[] file) {
    List<Map<String, Object>> rows = new ArrayList<>();
    try (ParquetFileReader reader = ParquetFileReader.open(new BytesInputFile(file))) {
      MessageType schema = reader.getFooter().getFileMetaData().getSchema();
      MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
      PageReadStore rowGroup;
      while ((rowGroup = reader.readNextRowGroup()) != null) {
        RecordReader<Group> records = columnIO.getRecordReader(rowGroup, new GroupRecordConverter(schema));
        for (long i = 0; i < rowGroup.getRowCount(); i++) {
          rows.add(toMap(records.read()));
        }
      }
    } catch (IOException | ParquetDecodingException e) {
      throw MapsException.malformed("Unable to decode GeoParquet " + locator, e);
    }
    LOG.info("Decoded {} rows from {}", rows.size(), locator);
    return rows;
  }

  static Map<String, Object> toMap(Group group) {
    GroupType type = group.getType();
    Map<String, Object> values = new LinkedHashMap<>();
    for (int field = 0; field < type.getFieldCount(); field++) {
      values.put(type.getFieldName(field), fieldValue(group, field));
    }
    return values;
  }

  private static Object fieldValue(Group group, int field) {
    Type type = group.getType().getType(field);
    int count = group.getFieldRepetitionCount(field);
    if (type.isRepetition(Type.Repetition.REPEATED)) {
      List<Object> repeated = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        repeated.add(value(group, field, i, type));
      }
      return repeated;
    }
    return count == 0 ? null : value(group, field, 0, type);
  }

  private static Object value(Group group, int field, int index, Type type) {
    if (type.isPrimitive()) {
      return primitive(group, field, index, type.asPrimitiveType());
    }
    Group nested = group.getGroup(field, index);
    LogicalTypeAnnotation logical = type.getLogicalTypeAnnotation();
    if (logical instanceof LogicalTypeAnnotation.ListLogicalTypeAnnotation) {
      return list(nested);
    }
    if (logical instanceof LogicalTypeAnnotation.MapLogicalTypeAnnotation) {
      return map(nested);
    }
    return toMap(nested);
  }

  /**
   * A list is a group around a repeated field, which wraps each element in a single field group in the standard
   * layout and holds the element directly in the legacy layouts.
   */
  private static List<Object> list(Group list) {
    List<Object> elements = new ArrayList<>();
    if (list.getType().getFieldCount() == 0) {
      return elements;
    }
    Type repeated = list.getType().getType(0);
    int count = list.getFieldRepetitionCount(0);
    for (int i = 0; i < count; i++) {
      if (!repeated.isPrimitive() && repeated.asGroupType().getFieldCount() == 1) {
        elements.add(fieldValue(list.getGroup(0, i), 0));
      } else {
        elements.add(value(list, 0, i, repeated));
      }
    }
    return elements;
  }

  private static Map<String, Object> map(Group map) {
    Map<String, Object> entries = new LinkedHashMap<>();
    int count = map.getFieldRepetitionCount(0);
    for (int i = 0; i < count; i++) {
      Group entry = map.getGroup(0, i);
      entries.put(String.valueOf(fieldValue(entry, 0)), entry.getType().getFieldCount() > 1 ? fieldValue(entry, 1) : null);
    }
    return entries;
  }

  private static Object primitive(Group group, int field, int index, PrimitiveType type) {
    switch (type.getPrimitiveTypeName()) {
      case BOOLEAN:
        return group.getBoolean(field, index);
      case INT32:
        return group.getInteger(field, index);
      case INT64:
        return group.getLong(field, index);
      case FLOAT:
        return group.getFloat(field, index);
      case DOUBLE:
        return group.getDouble(field, index);
      case BINARY:
        LogicalTypeAnnotation logical = type.getLogicalTypeAnnotation();
        if (logical instanceof LogicalTypeAnnotation.StringLogicalTypeAnnotation
            || logical instanceof LogicalTypeAnnotation.JsonLogicalTypeAnnotation
            || logical instanceof LogicalTypeAnnotation.EnumLogicalTypeAnnotation) {
          return group.getString(field, index);
        }
        return group.getBinary(field, index).getBytes();
      case INT96:
        return group.getInt96(field, index).getBytes();
      default:
        return group.getBinary(field, index).getBytes();
    }
  }

  /**
   * A Parquet input over a byte array.
   */
  static class BytesInputFile implements InputFile {
    private final byte[] data;

    BytesInputFile(byte[] data) {
      this.data = data;
    }

    @Override
    public long getLength() {
      return data.length;
    }

    @Override
    public SeekableInputStream newStream() {
      return new BytesSeekableInputStream(new PositionedStream(data));
    }
  }

  private static class PositionedStream extends ByteArrayInputStream {
    PositionedStream(byte[] data) {
      super(data);
    }

    long position() {
      return pos;
    }

    void seek(long position) {
      pos = (int) Math.min(position, count);
    }
  }

  private static class BytesSeekableInputStream extends DelegatingSeekableInputStream {
    private final PositionedStream stream;

    BytesSeekableInputStream(PositionedStream stream) {
      super(stream);
      this.stream = stream;
    }

    @Override
    public long getPos() {
      return stream.position();
    }

    @Override
    public void seek(long newPos) {
      stream.seek(newPos);
    }
  }
}
