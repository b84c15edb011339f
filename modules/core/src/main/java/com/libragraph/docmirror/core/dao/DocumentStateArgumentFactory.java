package com.libragraph.docmirror.core.dao;

import com.libragraph.docmirror.core.document.DocumentState;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class DocumentStateArgumentFactory extends AbstractArgumentFactory<DocumentState> {

    public DocumentStateArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(DocumentState value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}
