package com.instaclustr.hasher.cli.typeconverter;

import com.instaclustr.hasher.measure.DataSize;
import picocli.CommandLine;
import picocli.CommandLine.ITypeConverter;

public class DataSizeTypeConverter implements ITypeConverter<DataSize> {

    @Override
    public DataSize convert(final String value) {
        try {
            final DataSize dataSize = DataSize.parse(value);
            // sizes not representable in bytes are rejected here rather than when first used
            dataSize.toBytes();
            return dataSize;
        } catch (final IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        } catch (final ArithmeticException ex) {
            throw new CommandLine.TypeConversionException(String.format("Data size '%s' is too large", value));
        }
    }
}
