/**
 * Command construction bound to a single Receiver.
 *
 * @since 1.0.0
 * @author Trip Planner Team
 */
package com.ryuqq.tripplan.application.command;
