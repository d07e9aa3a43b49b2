package com.marketpool.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.avro.AvroWriteSupport;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Columnar codec. Parquet needs a seekable file, so both directions stage the
 * payload in a scratch directory that is removed afterwards.
 */
@Slf4j
public class ParquetTableCodec implements TableCodec {

    private static final String RECORD_NAME = "Row";

    @Override
    public byte[] encode(Table table) {
        Schema schema = toAvroSchema(table.getColumns());
        java.nio.file.Path scratch = createScratchDir();
        try {
            java.nio.file.Path file = scratch.resolve("table.parquet");
            Configuration conf = hadoopConf();
            try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                    .<GenericRecord>builder(HadoopOutputFile.fromPath(new Path(file.toUri()), conf))
                    .withSchema(schema)
                    .withConf(conf)
                    .withCompressionCodec(CompressionCodecName.SNAPPY)
                    .build()) {
                for (Map<String, Object> row : table.getRows()) {
                    writer.write(toRecord(schema, table.getColumns(), row));
                }
            }
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write parquet payload", e);
        } finally {
            deleteQuietly(scratch);
        }
    }

    @Override
    public Table decode(byte[] data, List<Table.Column> schema) {
        java.nio.file.Path scratch = createScratchDir();
        try {
            java.nio.file.Path file = scratch.resolve("table.parquet");
            Files.write(file, data);
            Configuration conf = hadoopConf();
            List<Map<String, Object>> rows = new ArrayList<>();
            try (ParquetReader<GenericRecord> reader = AvroParquetReader
                    .<GenericRecord>builder(HadoopInputFile.fromPath(new Path(file.toUri()), conf))
                    .withConf(conf)
                    .build()) {
                GenericRecord record;
                while ((record = reader.read()) != null) {
                    rows.add(fromRecord(record, schema));
                }
            }
            return new Table(schema, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read parquet payload", e);
        } catch (RuntimeException e) {
            // parquet-mr reports a bad footer or magic number as a bare RuntimeException
            throw new IllegalArgumentException("Malformed parquet payload: " + e.getMessage(), e);
        } finally {
            deleteQuietly(scratch);
        }
    }

    private Configuration hadoopConf() {
        Configuration conf = new Configuration();
        conf.setBoolean(AvroWriteSupport.WRITE_OLD_LIST_STRUCTURE, false);
        conf.setBoolean("parquet.avro.add-list-element-records", false);
        return conf;
    }

    static Schema toAvroSchema(List<Table.Column> columns) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME).fields();
        for (Table.Column column : columns) {
            switch (column.getType()) {
                case STRING:
                    fields = fields.name(column.getName()).type().nullable().stringType().noDefault();
                    break;
                case LONG:
                    fields = fields.name(column.getName()).type().nullable().longType().noDefault();
                    break;
                case DOUBLE:
                    fields = fields.name(column.getName()).type().nullable().doubleType().noDefault();
                    break;
                case BOOLEAN:
                    fields = fields.name(column.getName()).type().nullable().booleanType().noDefault();
                    break;
                case STRING_LIST:
                    fields = fields.name(column.getName()).type().nullable()
                            .array().items().nullable().stringType().noDefault();
                    break;
                case DOUBLE_LIST:
                    fields = fields.name(column.getName()).type().nullable()
                            .array().items().nullable().doubleType().noDefault();
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported column type: " + column.getType());
            }
        }
        return fields.endRecord();
    }

    private GenericRecord toRecord(Schema schema, List<Table.Column> columns, Map<String, Object> row) {
        GenericRecord record = new GenericData.Record(schema);
        for (Table.Column column : columns) {
            Object value = CellValues.coerce(row.get(column.getName()), column.getType());
            record.put(column.getName(), value);
        }
        return record;
    }

    private Map<String, Object> fromRecord(GenericRecord record, List<Table.Column> schema) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Table.Column column : schema) {
            Object value = record.getSchema().getField(column.getName()) == null ? null : record.get(column.getName());
            row.put(column.getName(), CellValues.coerce(value, column.getType()));
        }
        return row;
    }

    private java.nio.file.Path createScratchDir() {
        try {
            return Files.createTempDirectory("marketpool-parquet-");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create scratch directory", e);
        }
    }

    private void deleteQuietly(java.nio.file.Path dir) {
        try (Stream<java.nio.file.Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.warn("Could not remove scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
