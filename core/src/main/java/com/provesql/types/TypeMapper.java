package com.provesql.types;

import com.provesql.column.ColumnField;
import com.provesql.column.ColumnType;
import com.provesql.config.PlannerConfig;
import com.provesql.exception.PlannerException;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps upstream data types to provable column types.
 *
 * <p>Mapping:
 * <pre>
 *   BooleanType          → BOOLEAN
 *   UnsignedByteType     → UINT8
 *   ByteType             → TINYINT
 *   ShortType            → SMALLINT
 *   IntegerType          → INT
 *   LongType             → BIGINT
 *   DecimalType(p, s)    → DECIMAL75(p, s)      (p ≤ 75)
 *   StringType           → VARCHAR
 *   BinaryType           → BINARY
 *   TimestampType(u, z)  → TIMESTAMP(u, z)      (fixed-offset zones only, null = UTC)
 * </pre>
 *
 * <p>Float, Double, Date and struct types have no column type.
 *
 * @see ColumnType
 */
public final class TypeMapper {

    private TypeMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts an upstream data type to a column type.
     *
     * @param dataType the upstream data type
     * @return the column type
     * @throws PlannerException {@code UNSUPPORTED_DATA_TYPE} if the type has no column type
     */
    public static ColumnType toColumnType(DataType dataType) {
        if (dataType == null) {
            throw new IllegalArgumentException("dataType must not be null");
        }

        if (dataType instanceof BooleanType) {
            return ColumnType.BOOLEAN;
        } else if (dataType instanceof UnsignedByteType) {
            return ColumnType.UINT8;
        } else if (dataType instanceof ByteType) {
            return ColumnType.TINYINT;
        } else if (dataType instanceof ShortType) {
            return ColumnType.SMALLINT;
        } else if (dataType instanceof IntegerType) {
            return ColumnType.INT;
        } else if (dataType instanceof LongType) {
            return ColumnType.BIGINT;
        } else if (dataType instanceof StringType) {
            return ColumnType.VARCHAR;
        } else if (dataType instanceof BinaryType) {
            return ColumnType.VARBINARY;
        } else if (dataType instanceof DecimalType) {
            DecimalType decimal = (DecimalType) dataType;
            if (decimal.precision() > PlannerConfig.MAX_DECIMAL_PRECISION) {
                throw PlannerException.unsupportedDataType(dataType);
            }
            return ColumnType.decimal75(decimal.precision(), decimal.scale());
        } else if (dataType instanceof TimestampType) {
            TimestampType timestamp = (TimestampType) dataType;
            return ColumnType.timestampTz(timestamp.unit(), toZoneOffset(timestamp));
        }
        throw PlannerException.unsupportedDataType(dataType);
    }

    /**
     * Converts every field of a row schema to a column field, preserving order.
     *
     * @param schema the upstream row schema
     * @return the column fields
     * @throws PlannerException {@code UNSUPPORTED_DATA_TYPE} if any field has no column type
     */
    public static List<ColumnField> toColumnFields(StructType schema) {
        List<ColumnField> result = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            result.add(new ColumnField(field.name(), toColumnType(field.dataType())));
        }
        return result;
    }

    private static ZoneOffset toZoneOffset(TimestampType timestamp) {
        if (timestamp.timeZone() == null) {
            return ZoneOffset.UTC;
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timestamp.timeZone()).normalized();
        } catch (DateTimeException e) {
            throw new PlannerException(PlannerException.Kind.UNSUPPORTED_DATA_TYPE,
                "Unsupported timestamp zone: " + timestamp.timeZone(), timestamp, e);
        }
        if (!(zone instanceof ZoneOffset)) {
            throw PlannerException.unsupportedDataType(timestamp);
        }
        return (ZoneOffset) zone;
    }
}
