package com.provesql.types;

/**
 * Sealed interface for the data types of the upstream query plan.
 *
 * <p>These are the types an upstream analyzer annotates its plans with. Only a
 * subset has a provable counterpart; see {@link TypeMapper}.
 *
 * <p>Data types include:
 * <ul>
 *   <li>Integer types: UnsignedByteType, ByteType, ShortType, IntegerType, LongType</li>
 *   <li>Fixed point: DecimalType</li>
 *   <li>Floating point: FloatType, DoubleType</li>
 *   <li>Text and bytes: StringType, BinaryType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Row schemas: StructType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, UnsignedByteType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, DecimalType, StringType, BinaryType,
            DateType, TimestampType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Binary).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
