package com.farmerworking.skiplist.in.java.common;

import com.farmerworking.skiplist.in.java.api.Options;
import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogImpl implements Options.Logger {
    private final Gson gson;
    private final Logger logger;

    public LogImpl(String name) {
        this(LoggerFactory.getLogger(name));
    }

    LogImpl(Logger logger) {
        this.logger = logger;
        this.gson = new Gson();
    }

    @Override
    public void log(String msg, String... args) {
        if (!logger.isInfoEnabled()) {
            return;
        }

        if (args != null && args.length > 0) {
            logger.info(String.format("%s, args: %s", msg, gson.toJson(args)));
        } else {
            logger.info(msg);
        }
    }
}
