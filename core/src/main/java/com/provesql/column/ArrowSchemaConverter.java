package com.provesql.column;

import com.provesql.config.PlannerConfig;
import com.provesql.exception.PlannerException;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between Arrow schemas and provable column fields.
 *
 * <p>Type mapping:
 * <ul>
 *   <li>Bool ↔ BOOLEAN</li>
 *   <li>UInt8 ↔ UINT8; Int8/16/32/64 ↔ TINYINT/SMALLINT/INT/BIGINT</li>
 *   <li>Decimal(p, s) → DECIMAL75(p, s); INT128 → Decimal128(38, 0);
 *       SCALAR → Decimal256(75, 0)</li>
 *   <li>Utf8 ↔ VARCHAR; Binary ↔ BINARY</li>
 *   <li>Timestamp(unit, zone) ↔ TIMESTAMP(unit, zone); a missing zone reads as UTC</li>
 * </ul>
 *
 * <p>Provable columns hold no NULLs, so every produced field is non-nullable.
 */
public final class ArrowSchemaConverter {

    private static final Logger logger = LoggerFactory.getLogger(ArrowSchemaConverter.class);

    private static final int DECIMAL128_MAX_PRECISION = 38;

    private ArrowSchemaConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts an Arrow schema to an ordered list of column fields.
     *
     * @param schema the Arrow schema
     * @return the column fields in schema order
     * @throws PlannerException {@code UNSUPPORTED_DATA_TYPE} for an unmappable field type
     */
    public static List<ColumnField> toColumnFields(Schema schema) {
        List<ColumnField> fields = new ArrayList<>(schema.getFields().size());
        for (Field field : schema.getFields()) {
            fields.add(new ColumnField(field.getName(), toColumnType(field.getType())));
        }
        logger.debug("Converted Arrow schema with {} fields", fields.size());
        return fields;
    }

    /**
     * Converts column fields to an Arrow schema.
     *
     * @param fields the column fields
     * @return the Arrow schema
     */
    public static Schema toArrowSchema(List<ColumnField> fields) {
        List<Field> arrowFields = new ArrayList<>(fields.size());
        for (ColumnField field : fields) {
            arrowFields.add(Field.notNullable(field.name(), toArrowType(field.dataType())));
        }
        return new Schema(arrowFields);
    }

    /**
     * Converts an Arrow type to a column type.
     *
     * @param arrowType the Arrow type
     * @return the column type
     * @throws PlannerException {@code UNSUPPORTED_DATA_TYPE} if there is no mapping
     */
    public static ColumnType toColumnType(ArrowType arrowType) {
        if (arrowType instanceof ArrowType.Bool) {
            return ColumnType.BOOLEAN;
        } else if (arrowType instanceof ArrowType.Int) {
            ArrowType.Int intType = (ArrowType.Int) arrowType;
            if (!intType.getIsSigned()) {
                if (intType.getBitWidth() == 8) {
                    return ColumnType.UINT8;
                }
            } else if (intType.getBitWidth() == 8) {
                return ColumnType.TINYINT;
            } else if (intType.getBitWidth() == 16) {
                return ColumnType.SMALLINT;
            } else if (intType.getBitWidth() == 32) {
                return ColumnType.INT;
            } else if (intType.getBitWidth() == 64) {
                return ColumnType.BIGINT;
            }
        } else if (arrowType instanceof ArrowType.Decimal) {
            ArrowType.Decimal decimalType = (ArrowType.Decimal) arrowType;
            if (decimalType.getPrecision() <= PlannerConfig.MAX_DECIMAL_PRECISION) {
                return ColumnType.decimal75(decimalType.getPrecision(), decimalType.getScale());
            }
        } else if (arrowType instanceof ArrowType.Utf8) {
            return ColumnType.VARCHAR;
        } else if (arrowType instanceof ArrowType.Binary) {
            return ColumnType.VARBINARY;
        } else if (arrowType instanceof ArrowType.Timestamp) {
            ArrowType.Timestamp timestampType = (ArrowType.Timestamp) arrowType;
            return ColumnType.timestampTz(toTimeUnit(timestampType.getUnit()),
                toZoneOffset(timestampType.getTimezone(), arrowType));
        }
        throw PlannerException.unsupportedDataType(arrowType);
    }

    /**
     * Converts a column type to an Arrow type.
     *
     * @param columnType the column type
     * @return the Arrow type
     */
    public static ArrowType toArrowType(ColumnType columnType) {
        switch (columnType.kind()) {
            case BOOLEAN:
                return ArrowType.Bool.INSTANCE;
            case UINT8:
                return new ArrowType.Int(8, false);
            case TINYINT:
                return new ArrowType.Int(8, true);
            case SMALLINT:
                return new ArrowType.Int(16, true);
            case INT:
                return new ArrowType.Int(32, true);
            case BIGINT:
                return new ArrowType.Int(64, true);
            case INT128:
                return new ArrowType.Decimal(DECIMAL128_MAX_PRECISION, 0, 128);
            case DECIMAL75:
                int bitWidth = columnType.precision() <= DECIMAL128_MAX_PRECISION ? 128 : 256;
                return new ArrowType.Decimal(columnType.precision(), columnType.scale(), bitWidth);
            case SCALAR:
                return new ArrowType.Decimal(PlannerConfig.MAX_DECIMAL_PRECISION, 0, 256);
            case VARCHAR:
                return ArrowType.Utf8.INSTANCE;
            case VARBINARY:
                return ArrowType.Binary.INSTANCE;
            case TIMESTAMP_TZ:
                return new ArrowType.Timestamp(toArrowTimeUnit(columnType.timeUnit()),
                    columnType.timeZone().getId());
            default:
                throw new IllegalStateException("Unknown column type: " + columnType);
        }
    }

    private static TimeUnit toTimeUnit(org.apache.arrow.vector.types.TimeUnit unit) {
        switch (unit) {
            case SECOND:
                return TimeUnit.SECOND;
            case MILLISECOND:
                return TimeUnit.MILLISECOND;
            case MICROSECOND:
                return TimeUnit.MICROSECOND;
            case NANOSECOND:
            default:
                return TimeUnit.NANOSECOND;
        }
    }

    private static org.apache.arrow.vector.types.TimeUnit toArrowTimeUnit(TimeUnit unit) {
        switch (unit) {
            case SECOND:
                return org.apache.arrow.vector.types.TimeUnit.SECOND;
            case MILLISECOND:
                return org.apache.arrow.vector.types.TimeUnit.MILLISECOND;
            case MICROSECOND:
                return org.apache.arrow.vector.types.TimeUnit.MICROSECOND;
            case NANOSECOND:
            default:
                return org.apache.arrow.vector.types.TimeUnit.NANOSECOND;
        }
    }

    private static ZoneOffset toZoneOffset(String timezone, ArrowType arrowType) {
        if (timezone == null || timezone.isEmpty()) {
            return ZoneOffset.UTC;
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone).normalized();
        } catch (DateTimeException e) {
            throw new PlannerException(PlannerException.Kind.UNSUPPORTED_DATA_TYPE,
                "Unsupported timestamp zone: " + timezone, arrowType, e);
        }
        if (!(zone instanceof ZoneOffset)) {
            // region zones have no fixed offset
            throw PlannerException.unsupportedDataType(arrowType);
        }
        return (ZoneOffset) zone;
    }
}
